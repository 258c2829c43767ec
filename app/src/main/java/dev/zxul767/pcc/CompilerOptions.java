package dev.zxul767.pcc;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Read-only configuration of a single compilation.
public class CompilerOptions {
  private static final Logger logger = LoggerFactory.getLogger(CompilerOptions.class);

  public static final String BACKEND_PROPERTY = "pcc.backend";
  public static final String DEFAULT_SOURCE_NAME = "<stdin>";
  private static final String RESOURCE = "/pcc.properties";

  public final Backend backend;
  // appears in diagnostics and in the exceptions raised by the generated program
  public final String sourceName;

  public CompilerOptions(Backend backend, String sourceName) {
    this.backend = backend;
    this.sourceName = sourceName;
  }

  public static CompilerOptions defaults() {
    return new CompilerOptions(Backend.FAST, DEFAULT_SOURCE_NAME);
  }

  // defaults < pcc.properties on the classpath < JVM system properties
  public static CompilerOptions load() {
    Properties properties = new Properties();
    try (InputStream in = CompilerOptions.class.getResourceAsStream(RESOURCE)) {
      if (in != null)
        properties.load(in);
    } catch (IOException e) {
      logger.warn("Could not read {}: {}", RESOURCE, e.getMessage());
    }
    String backend = System.getProperty(
        BACKEND_PROPERTY, properties.getProperty(BACKEND_PROPERTY, "fast")
    );
    return new CompilerOptions(Backend.parse(backend), DEFAULT_SOURCE_NAME);
  }

  public CompilerOptions withBackend(Backend backend) {
    return new CompilerOptions(backend, sourceName);
  }

  public CompilerOptions withSourceName(String sourceName) {
    return new CompilerOptions(backend, sourceName);
  }

  @Override
  public String toString() {
    return String.format("backend=%s, source=%s", backend, sourceName);
  }
}
