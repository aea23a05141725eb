package com.pulsefocus.backend.repository;

import com.pulsefocus.backend.entity.FocusProfile;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface FocusProfileRepository extends MongoRepository<FocusProfile, String> {
}
