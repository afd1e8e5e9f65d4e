package com.eyelevel.documentcompressor.repository;

import com.eyelevel.documentcompressor.model.DocumentType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@link DocumentType} entity.
 */
@Repository
public interface DocumentTypeRepository extends JpaRepository<DocumentType, String> {

    List<DocumentType> findAllByOrderByIdAsc();
}
