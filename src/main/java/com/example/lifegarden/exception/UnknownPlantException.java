package com.example.lifegarden.exception;

public class UnknownPlantException extends RuntimeException {
  private final String identifier;

  public UnknownPlantException(String identifier) {
    super("Plant '" + identifier + "' not found");
    this.identifier = identifier;
  }

  public String getIdentifier() {
    return identifier;
  }
}
