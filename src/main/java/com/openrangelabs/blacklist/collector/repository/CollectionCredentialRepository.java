package com.openrangelabs.blacklist.collector.repository;

import com.openrangelabs.blacklist.collector.entity.CollectionCredential;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Read access to stored source credentials
 */
@Repository
public interface CollectionCredentialRepository extends R2dbcRepository<CollectionCredential, Long> {

    Mono<CollectionCredential> findByServiceName(String serviceName);
}
