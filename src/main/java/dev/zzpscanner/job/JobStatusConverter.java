package dev.zzpscanner.job;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link JobStatus} as its lowercase value and rejects unknown strings on load. */
@Converter
public class JobStatusConverter implements AttributeConverter<JobStatus, String> {

  @Override
  public String convertToDatabaseColumn(JobStatus status) {
    return status == null ? null : status.value();
  }

  @Override
  public JobStatus convertToEntityAttribute(String value) {
    return value == null ? null : JobStatus.fromValue(value);
  }
}
