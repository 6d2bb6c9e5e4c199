package com.github.fsmcodegen;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import com.github.fsmcodegen.model.FsmModel;
import com.github.fsmcodegen.parser.FsmParser;

/**
 * Access to the .fsm sources under src/test/resources/fsm.
 */
public final class Fixtures {
  public static final String TRAFFIC_LIGHT = "traffic_light.fsm";
  public static final String DOOR_LOCK = "door_lock.fsm";
  public static final String MOTOR = "motor.fsm";

  private Fixtures() {}

  public static String read(final String name) throws IOException {
    try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fsm/" + name)) {
      if (in == null) {
        throw new IOException("Missing fixture " + name);
      }
      final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      final byte[] buffer = new byte[4096];
      int read;
      while ((read = in.read(buffer)) != -1) {
        bytes.write(buffer, 0, read);
      }
      return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }
  }

  public static Path path(final String name) throws URISyntaxException {
    return Paths.get(Fixtures.class.getClassLoader().getResource("fsm/" + name).toURI());
  }

  public static FsmModel model(final String name) throws IOException, FsmException {
    final List<FsmModel> models = new FsmParser().parse(read(name));
    if (models.size() != 1) {
      throw new IllegalStateException(name + " declares " + models.size() + " fsms");
    }
    return models.get(0);
  }
}
