package io.b2mash.b2b.inquiryquote.exception;

/**
 * Malformed pricing configuration: tax rate, validity period, price list or discount tiers. Thrown
 * while the application context starts, before any email is processed.
 */
public class CatalogConfigurationException extends RuntimeException {

  public CatalogConfigurationException(String message) {
    super(message);
  }

  public CatalogConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
