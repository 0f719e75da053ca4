package com.codeheadsystems.qcheck.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

/**
 * Initial program entity handed to the workbook checker for the proposal a file
 * is being checked against. Hours and category are unknown at check time.
 *
 * @param proposalId upper-cased proposal identifier
 * @param hours      allocated hours
 * @param category   program category
 */
public record Program(
    @JsonProperty("proposalId") String proposalId,
    @JsonProperty("hours") double hours,
    @JsonProperty("category") String category) {

  public static Program forProposal(String proposalId) {
    return new Program(proposalId.toUpperCase(Locale.ROOT), 0, "");
  }
}
