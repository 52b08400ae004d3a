package se.alipsa.lgtrefactor.core.refactor.extract;

/** Name manipulation on document URIs ({@code file:///dir/name.lgt} or plain paths). */
public final class FileUris {

  private FileUris() {}

  /** A URI for {@code fileName} in the same directory as {@code uri}. */
  public static String sibling(String uri, String fileName) {
    int slash = uri.lastIndexOf('/');
    return slash < 0 ? fileName : uri.substring(0, slash + 1) + fileName;
  }

  public static String fileName(String uri) {
    return uri.substring(uri.lastIndexOf('/') + 1);
  }

  /** Resolve a relative path against the directory of {@code uri}; {@code ..} segments are collapsed. */
  public static String resolve(String uri, String relative) {
    if (relative.startsWith("/")) {
      int scheme = uri.indexOf(":///");
      return scheme >= 0 ? uri.substring(0, scheme + 3) + relative : relative;
    }
    String base = sibling(uri, "");
    String[] parts = relative.split("/");
    StringBuilder sb = new StringBuilder(base);
    for (String part : parts) {
      if (part.isEmpty() || part.equals(".")) continue;
      if (part.equals("..")) {
        int end = sb.length() - 1;
        int prev = sb.lastIndexOf("/", end - 1);
        if (prev >= 0 && !sb.substring(prev + 1, end).isEmpty() && !sb.substring(0, prev + 1).endsWith("//")) {
          sb.setLength(prev + 1);
        }
        continue;
      }
      sb.append(part).append('/');
    }
    if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '/' && !relative.endsWith("/")) sb.setLength(sb.length() - 1);
    return sb.toString();
  }

  /** True when the last path segment has an extension. */
  public static boolean hasExtension(String name) {
    String file = fileName(name);
    int dot = file.lastIndexOf('.');
    return dot > 0 && dot < file.length() - 1;
  }
}
