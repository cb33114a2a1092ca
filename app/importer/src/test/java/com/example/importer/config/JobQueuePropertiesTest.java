package com.example.importer.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.importer.model.JobKind;
import com.example.importer.model.JobQueue;
import com.example.importer.support.TestFixtures;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobQueuePropertiesTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWithDefaults() {
    assertTrue(validator.validate(TestFixtures.queueProperties()).isEmpty());
  }

  @Test
  void validationFailsWhenAckWaitIsZero() {
    assertFalse(validator.validate(withAckWait(Duration.ZERO)).isEmpty());
  }

  @Test
  void validationFailsWhenAckWaitIsNegative() {
    assertFalse(validator.validate(withAckWait(Duration.ofSeconds(-1))).isEmpty());
  }

  @Test
  void subjectsAndDurablesFollowQueueName() {
    final JobQueueProperties properties = TestFixtures.queueProperties();

    assertThat(properties.subject(JobQueue.IMPORT)).isEqualTo("jobs.import");
    assertThat(properties.deadLetterSubject(JobQueue.BULK_DELETE))
        .isEqualTo("jobs.dead.bulk-delete");
    assertThat(properties.durable(JobQueue.DEFAULT)).isEqualTo("catalog-worker-default");
    assertThat(properties.concurrency(JobQueue.IMPORT)).isEqualTo(2);
  }

  @Test
  void kindsWithoutDedicatedRouteFallBackToDefaultQueue() {
    final JobQueueProperties properties =
        new JobQueueProperties(
            "catalog-jobs",
            "jobs",
            Duration.ofHours(2),
            Duration.ofMinutes(2),
            "catalog-jobs-dead",
            Duration.ofDays(7),
            "catalog-worker",
            Duration.ofMinutes(5),
            5,
            Duration.ofSeconds(5),
            2,
            1,
            1,
            Map.of(JobKind.IMPORT, JobQueue.IMPORT));

    assertThat(properties.route(JobKind.IMPORT)).isEqualTo(JobQueue.IMPORT);
    assertThat(properties.route(JobKind.BULK_DELETE)).isEqualTo(JobQueue.DEFAULT);
  }

  private static JobQueueProperties withAckWait(Duration ackWait) {
    return new JobQueueProperties(
        "catalog-jobs",
        "jobs",
        Duration.ofHours(2),
        Duration.ofMinutes(2),
        "catalog-jobs-dead",
        Duration.ofDays(7),
        "catalog-worker",
        ackWait,
        5,
        Duration.ofSeconds(5),
        2,
        1,
        1,
        Map.of());
  }
}
