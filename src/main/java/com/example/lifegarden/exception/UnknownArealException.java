package com.example.lifegarden.exception;

public class UnknownArealException extends RuntimeException {
  public UnknownArealException(String arealId) {
    super("Areal '" + arealId + "' not found");
  }
}
