package com.pulsefocus.backend.repository;

import com.pulsefocus.backend.entity.OuraCredential;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface OuraCredentialRepository extends MongoRepository<OuraCredential, String> {
}
