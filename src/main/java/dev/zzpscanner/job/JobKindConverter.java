package dev.zzpscanner.job;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link JobKind} as its wire value and rejects unknown strings on load. */
@Converter
public class JobKindConverter implements AttributeConverter<JobKind, String> {

  @Override
  public String convertToDatabaseColumn(JobKind kind) {
    return kind == null ? null : kind.value();
  }

  @Override
  public JobKind convertToEntityAttribute(String value) {
    return value == null ? null : JobKind.fromValue(value);
  }
}
