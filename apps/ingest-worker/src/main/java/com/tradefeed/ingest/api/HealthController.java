package com.tradefeed.ingest.api;

import com.tradefeed.ingest.health.IngestHealth;
import com.tradefeed.ingest.health.IngestHealthService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
  private final IngestHealthService healthService;

  public HealthController(IngestHealthService healthService) {
    this.healthService = healthService;
  }

  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    IngestHealth health = healthService.health();
    HttpStatus status = health.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    return ResponseEntity.status(status).body(HealthResponse.from(health));
  }

  @GetMapping("/stats")
  public StatsResponse stats() {
    return StatsResponse.from(healthService.stats());
  }

  @GetMapping("/pairs")
  public PairsResponse pairs() {
    return PairsResponse.from(healthService.pairs());
  }
}
