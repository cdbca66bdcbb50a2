package com.gentoro.gscmcp.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One account as supplied by a credential source, before validation. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountEntry {
  private String id;
  private String email;
  private String refreshToken;
  private String accessToken;
  private Long expiresAt;

  public AccountEntry() {}

  public AccountEntry(String id, String email, String refreshToken, String accessToken) {
    this.id = id;
    this.email = email;
    this.refreshToken = refreshToken;
    this.accessToken = accessToken;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getEmail() {
    return email;
  }

  public void setEmail(String email) {
    this.email = email;
  }

  public String getRefreshToken() {
    return refreshToken;
  }

  public void setRefreshToken(String refreshToken) {
    this.refreshToken = refreshToken;
  }

  public String getAccessToken() {
    return accessToken;
  }

  public void setAccessToken(String accessToken) {
    this.accessToken = accessToken;
  }

  public Long getExpiresAt() {
    return expiresAt;
  }

  public void setExpiresAt(Long expiresAt) {
    this.expiresAt = expiresAt;
  }

  @Override
  public String toString() {
    return "AccountEntry{id='" + id + "', email='" + email + "'}";
  }
}
