package io.topowarden.management;

public enum MutationStatus {
  CREATED,
  ALREADY_EXISTS,
  FAILED;

  public boolean isSuccess() {
    return this != FAILED;
  }
}
