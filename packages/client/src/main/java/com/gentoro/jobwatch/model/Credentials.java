package com.gentoro.jobwatch.model;

/** Credentials submitted to start the auth handshake. */
public record Credentials(String apiId, String apiHash, String phoneNumber) {

  public boolean isComplete() {
    return notBlank(apiId) && notBlank(apiHash) && notBlank(phoneNumber);
  }

  private static boolean notBlank(String s) {
    return s != null && !s.isBlank();
  }

  @Override
  public String toString() {
    String phone = phoneNumber == null ? "" : phoneNumber;
    String tail = phone.length() <= 4 ? phone : phone.substring(phone.length() - 4);
    return "Credentials{apiId=" + apiId + ", apiHash=***, phone=***" + tail + "}";
  }
}
