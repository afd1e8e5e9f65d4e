package com.eyelevel.documentcompressor.config;

import com.eyelevel.documentcompressor.service.policy.PolicyRegistry;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.cache.transaction.TransactionAwareCacheManagerProxy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-memory policy cache. Puts and evictions issued inside a transaction take effect only once it commits.
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager() {
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(PolicyRegistry.POLICY_CACHE);
        cacheManager.setAllowNullValues(false);
        return new TransactionAwareCacheManagerProxy(cacheManager);
    }
}
