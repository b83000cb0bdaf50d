package com.lendkeeper.executor.chain;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.crypto.exception.CipherException;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.WalletUtils;

import java.io.IOException;
import java.util.Optional;

/**
 * Keeper account credentials, loaded once from a raw private key or an encrypted keystore file.
 */
@Component
@Slf4j
public class SignerContext {

  private final Credentials credentials;

  @Autowired
  public SignerContext(@NonNull ChainProperties chainProperties) {
    this(load(chainProperties));
  }

  SignerContext(Credentials credentials) {
    this.credentials = credentials;
    if (credentials == null) {
      log.warn("no keeper credentials configured; only dry-run evaluation is possible");
    } else {
      log.info("keeper account {}", credentials.getAddress());
    }
  }

  public static SignerContext of(Credentials credentials) {
    return new SignerContext(credentials);
  }

  public Optional<Credentials> credentials() {
    return Optional.ofNullable(credentials);
  }

  public Credentials requireCredentials() {
    if (credentials == null) {
      throw new IllegalStateException("keeper.chain.private-key or keeper.chain.keystore-path must be configured");
    }
    return credentials;
  }

  public Optional<String> address() {
    return credentials().map(Credentials::getAddress);
  }

  private static Credentials load(ChainProperties properties) {
    String key = properties.privateKey();
    if (key != null && !key.isBlank()) {
      return Credentials.create(key.trim());
    }
    String path = properties.keystorePath();
    if (path == null || path.isBlank()) {
      return null;
    }
    String password = properties.keystorePassword() == null ? "" : properties.keystorePassword();
    try {
      return WalletUtils.loadCredentials(password, path);
    } catch (IOException | CipherException e) {
      throw new IllegalStateException("failed to load keystore " + path + ": " + e.getMessage(), e);
    }
  }
}
