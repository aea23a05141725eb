package com.pulsefocus.backend.service;

import com.pulsefocus.backend.entity.OuraCredential;
import com.pulsefocus.backend.repository.OuraCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reactive facade over the blocking credential repository. Only
 * {@link OuraTokenService} reads raw tokens through it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CredentialStore {

    private final OuraCredentialRepository repo;

    /** Emits the stored credential, or completes empty when the user never connected. */
    public Mono<OuraCredential> find(String userId) {
        return Mono.fromCallable(() -> repo.findById(userId).orElse(null))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /** Keyed on user id, so this replaces any previous envelope in one write. */
    public Mono<OuraCredential> upsert(OuraCredential credential) {
        return Mono.fromCallable(() -> repo.save(credential))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Void> delete(String userId) {
        return Mono.fromRunnable(() -> {
                    repo.deleteById(userId);
                    log.info("Oura credential revoked for user {}", userId);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }
}
