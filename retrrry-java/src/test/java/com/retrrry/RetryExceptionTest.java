package com.retrrry;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import org.junit.jupiter.api.Test;

class RetryExceptionTest {

  @Test
  void testAttemptNumberSurvivesSerialization() throws Exception {
    final RetryException original =
        new RetryException(Attempt.failure(4, 0L, new IOException("transient")));

    final RetryException copy = roundTrip(original);

    assertThat(copy.getAttemptNumber()).isEqualTo(4);
    assertThat(copy.getLastAttempt()).isNull();
    assertThat(copy.getCause()).isInstanceOf(IOException.class).hasMessage("transient");
    assertThat(copy.getMessage()).isEqualTo(original.getMessage());
  }

  @Test
  void testValueAttemptHasNoCause() {
    final RetryException exception = new RetryException(Attempt.value(3, 0L, "rejected"));

    assertThat(exception.getAttemptNumber()).isEqualTo(3);
    assertThat(exception.getCause()).isNull();
    assertThat(exception.getMessage()).isEqualTo("RetryError[Attempts: 3, Value: rejected]");
  }

  private static RetryException roundTrip(RetryException exception) throws Exception {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(exception);
    }
    try (ObjectInputStream in =
        new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      return (RetryException) in.readObject();
    }
  }
}
