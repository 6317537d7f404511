package com.quantori.nqp.core.service;

import akka.NotUsed;
import akka.stream.ActorAttributes;
import akka.stream.Supervision;
import akka.stream.javadsl.Source;
import akka.util.ByteString;
import com.quantori.nqp.core.format.OutputFormat;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Adapts the body of a text response to an Akka Streams source, one element per body unit. The body is pulled on
 * demand only, completing, failing or cancelling the stream closes the response.
 */
@Slf4j
public final class ResponseSource {

  private ResponseSource() {
  }

  public static Source<ByteString, NotUsed> of(QueryResponse response) {
    if (response.getFormat() == OutputFormat.RAW || response.getFormat() == OutputFormat.QUERY) {
      throw new IllegalArgumentException("Format " + response.getFormat() + " has no byte representation");
    }
    return Source.unfoldResource(() -> response, r -> {
          try {
            if (!r.getBody().hasNext()) {
              return Optional.<ByteString>empty();
            }
            return Optional.of(ByteString.fromString(String.valueOf(r.getBody().next())));
          } catch (RuntimeException e) {
            log.error("Unable to read response body", e);
            throw e;
          }
        }, QueryResponse::close)
        .withAttributes(ActorAttributes.withSupervisionStrategy(Supervision.getStoppingDecider()));
  }
}
