package io.flagstore.subsystems;

/**
 * Thrown when flag or segment JSON cannot be decoded, or an item cannot be encoded.
 * <p>
 * Wraps whatever the JSON library threw, so that callers never see Gson exception types.
 */
@SuppressWarnings("serial")
public class SerializationException extends RuntimeException {
  public SerializationException(Throwable cause) {
    super(cause);
  }
}
