package se.alipsa.lgtrefactor.core.host;

import java.io.IOException;

/** Opens documents by URI on demand. */
public interface DocumentProvider {

  Document open(String uri) throws IOException;

  boolean exists(String uri);
}
