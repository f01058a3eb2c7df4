package com.example.predictor.cpg.codec;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import org.springframework.http.MediaType;

/** Wire encodings the predictor can read and write. JSON is the primary, self-describing one. */
public enum WireFormat {
  JSON("application/json"),
  MSGPACK("application/msgpack");

  private final String mimeType;

  WireFormat(String mimeType) {
    this.mimeType = mimeType;
  }

  public String getMimeType() {
    return mimeType;
  }

  public MediaType toMediaType() {
    return MediaType.parseMediaType(mimeType);
  }

  public static Optional<WireFormat> fromMimeType(String mimeType) {
    if (mimeType == null) {
      return Optional.empty();
    }
    String normalized = mimeType.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(format -> format.mimeType.equals(normalized))
        .findFirst();
  }
}
