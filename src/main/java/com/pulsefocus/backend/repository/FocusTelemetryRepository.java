package com.pulsefocus.backend.repository;

import com.pulsefocus.backend.entity.FocusTelemetry;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface FocusTelemetryRepository extends MongoRepository<FocusTelemetry, String> {
}
