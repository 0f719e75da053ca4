package com.codeheadsystems.qcheck.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregated result of checking one submission.
 * <p>
 * Datasets and messages keep their insertion order. A message may name a dataset
 * that has no tabular contents (for example when the workbook could not be read);
 * such datasets are ordered after the known ones, by first appearance.
 *
 * @param datasets the parsed sheets
 * @param messages every warning and error, in the order they were produced
 */
@JsonIgnoreProperties(value = {"errorCount", "warningCount"}, allowGetters = true)
public record ValidationReport(
    @JsonProperty("datasets") List<Dataset> datasets,
    @JsonProperty("messages") List<ValidationMessage> messages) {

  public ValidationReport {
    datasets = datasets == null ? List.of() : List.copyOf(datasets);
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public static ValidationReport empty() {
    return new ValidationReport(List.of(), List.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  @JsonProperty("errorCount")
  public int errorCount() {
    return count(Severity.ERROR);
  }

  @JsonProperty("warningCount")
  public int warningCount() {
    return count(Severity.WARNING);
  }

  @JsonIgnore
  public boolean isClean() {
    return errorCount() == 0;
  }

  public Optional<Dataset> dataset(String name) {
    return datasets.stream().filter(d -> d.name().equals(name)).findFirst();
  }

  /**
   * Names of every dataset that has contents or messages, in report order.
   *
   * @return the dataset names
   */
  @JsonIgnore
  public List<String> datasetNames() {
    Map<String, Boolean> names = new LinkedHashMap<>();
    datasets.forEach(d -> names.put(d.name(), Boolean.TRUE));
    messages.forEach(m -> names.putIfAbsent(m.dataset(), Boolean.TRUE));
    return new ArrayList<>(names.keySet());
  }

  public List<ValidationMessage> messagesFor(String dataset, Severity severity) {
    return messages.stream()
        .filter(m -> m.dataset().equals(dataset) && m.severity() == severity)
        .toList();
  }

  private int count(Severity severity) {
    return (int) messages.stream().filter(m -> m.severity() == severity).count();
  }

  /**
   * Accumulates datasets and messages while a workbook is being checked.
   */
  public static class Builder {

    private final List<Dataset> datasets = new ArrayList<>();
    private final List<ValidationMessage> messages = new ArrayList<>();

    public Builder dataset(Dataset dataset) {
      datasets.add(dataset);
      return this;
    }

    public Builder message(ValidationMessage message) {
      messages.add(message);
      return this;
    }

    public Builder error(String dataset, Integer row, List<String> columns, String message) {
      return message(new ValidationMessage(dataset, row, columns, message, Severity.ERROR));
    }

    public Builder warning(String dataset, Integer row, List<String> columns, String message) {
      return message(new ValidationMessage(dataset, row, columns, message, Severity.WARNING));
    }

    public ValidationReport build() {
      return new ValidationReport(datasets, messages);
    }
  }
}
