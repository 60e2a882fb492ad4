package scriptsync.core.transform;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import scriptsync.core.remote.RemoteFile;
import scriptsync.core.remote.RemoteFileType;

/**
 * Maps remote files to local files and back. Rules are tried in order and the first match wins:
 *
 * <ol>
 *   <li>{@code README} markup ⇄ {@code README.md}, converting HTML and Markdown.
 *   <li>Top-level dotfiles keep their name; remotely the text sits inside a module shim.
 *   <li>{@code .git/<rest>} ⇄ {@code .git-gas/<rest>}.
 *   <li>Anything else: {@code _} ⇄ {@code /}, an extension by type, code unwrapped from its
 *       module shim.
 * </ol>
 */
public class ContentTransformer {
  public static final String BREADCRUMB_MIRROR_DIR = ".git-gas";
  public static final String REMOTE_GIT_DIR = ".git";

  private static final String README = "README";
  private static final String README_MD = "README.md";
  private static final String MARKDOWN_MARKER = "name=\"file-type\" content=\"markdown-to-html\"";
  private static final Pattern BODY = Pattern.compile("(?is)<body[^>]*>(.*?)</body>");

  private final MarkdownConverter markdownConverter;
  private final GitFileShim gitFileShim;

  public ContentTransformer(MarkdownConverter markdownConverter, GitFileShim gitFileShim) {
    this.markdownConverter = markdownConverter;
    this.gitFileShim = gitFileShim;
  }

  public String localPathFor(RemoteFile remote) {
    String name = remote.name();
    if (isRemoteReadme(remote)) {
      return remoteNameToPath(name) + ".md";
    }
    if (isDotfileName(name)) {
      return name;
    }
    if (name.startsWith(REMOTE_GIT_DIR + "/")) {
      return BREADCRUMB_MIRROR_DIR + name.substring(REMOTE_GIT_DIR.length());
    }
    if (ModuleShim.isSystemModule(name)) {
      return name + remote.type().localExtension();
    }
    return remoteNameToPath(name) + remote.type().localExtension();
  }

  public LocalFile toLocal(RemoteFile remote) {
    String name = remote.name();
    String text;
    if (isRemoteReadme(remote)) {
      text = htmlDocumentToMarkdown(remote.content());
    } else if (isDotfileName(name)) {
      text = DotfileShim.unwrap(remote.content());
    } else if (name.startsWith(REMOTE_GIT_DIR + "/")) {
      text = gitFileShim.unwrap(remote.content());
    } else if (remote.type() == RemoteFileType.CODE && !ModuleShim.isSystemModule(name)) {
      text = ModuleShim.unwrap(remote.content()).body();
    } else {
      text = remote.content();
    }
    return LocalFile.ofText(localPathFor(remote), text, remote.updateTime());
  }

  public Optional<RemoteFile> toRemote(LocalFile local) {
    return toRemote(local, null);
  }

  /**
   * Builds the remote form of {@code local}. When {@code previous} is the remote file the local
   * one was pulled from, its name is kept and its module options are restored on re-wrap.
   * Returns empty for files the remote store cannot hold.
   */
  public Optional<RemoteFile> toRemote(LocalFile local, RemoteFile previous) {
    String path = local.relativePath();
    String text = local.text();
    if (path.equals(REMOTE_GIT_DIR) || path.startsWith(REMOTE_GIT_DIR + "/")) {
      return Optional.empty();
    }

    if (path.startsWith(BREADCRUMB_MIRROR_DIR + "/")) {
      String name = REMOTE_GIT_DIR + path.substring(BREADCRUMB_MIRROR_DIR.length());
      return Optional.of(remote(previous, name, RemoteFileType.CODE, gitFileShim.wrap(text, name)));
    }

    String fileName = path.substring(path.lastIndexOf('/') + 1);
    if (fileName.equalsIgnoreCase(README_MD)) {
      String dir = path.substring(0, path.length() - fileName.length());
      String name = previous != null ? previous.name() : pathToRemoteName(dir) + README;
      return Optional.of(
          remote(previous, name, RemoteFileType.MARKUP, markdownToHtmlDocument(text, fileName)));
    }

    if (isDotfileName(path)) {
      return Optional.of(remote(previous, path, RemoteFileType.CODE, DotfileShim.wrap(text, path)));
    }

    int dot = fileName.lastIndexOf('.');
    if (dot <= 0) {
      return Optional.empty();
    }
    RemoteFileType type = typeForExtension(fileName.substring(dot).toLowerCase(Locale.ROOT));
    if (type == null) {
      return Optional.empty();
    }

    String stem = path.substring(0, path.length() - (fileName.length() - dot));
    String name = previous != null ? previous.name() : pathToRemoteName(stem);
    String content = text;
    if (type == RemoteFileType.CODE && !ModuleShim.isSystemModule(name)) {
      ModuleOptions options =
          previous != null && previous.type() == RemoteFileType.CODE
              ? ModuleShim.unwrap(previous.content()).options()
              : ModuleOptions.NONE;
      content = ModuleShim.wrap(text, options, name);
    }
    return Optional.of(remote(previous, name, type, content));
  }

  private static RemoteFile remote(
      RemoteFile previous, String name, RemoteFileType type, String content) {
    if (previous == null) {
      return RemoteFile.of(name, type, content);
    }
    return new RemoteFile(name, type, content, previous.position(), previous.updateTime());
  }

  private static RemoteFileType typeForExtension(String extension) {
    return switch (extension) {
      case ".js", ".gs" -> RemoteFileType.CODE;
      case ".html" -> RemoteFileType.MARKUP;
      case ".json" -> RemoteFileType.DATA;
      default -> null;
    };
  }

  private static boolean isRemoteReadme(RemoteFile remote) {
    if (remote.type() != RemoteFileType.MARKUP) {
      return false;
    }
    String path = remoteNameToPath(remote.name());
    return path.equals(README) || path.endsWith("/" + README);
  }

  private static boolean isDotfileName(String name) {
    return name.length() > 1
        && name.charAt(0) == '.'
        && name.indexOf('/') < 0
        && !name.equals(REMOTE_GIT_DIR)
        && !name.equals(BREADCRUMB_MIRROR_DIR);
  }

  /** {@code a_b} becomes {@code a/b}; names that would yield an empty segment are kept verbatim. */
  static String remoteNameToPath(String name) {
    if (name.indexOf('_') < 0) {
      return name;
    }
    for (String segment : name.replace('/', '_').split("_", -1)) {
      if (segment.isEmpty()) {
        return name;
      }
    }
    return name.replace('_', '/');
  }

  static String pathToRemoteName(String path) {
    String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    String name = trimmed.replace('/', '_');
    return path.endsWith("/") && !name.isEmpty() ? name + "_" : name;
  }

  private String markdownToHtmlDocument(String markdown, String fileName) {
    String title = fileName.endsWith(".md") ? fileName.substring(0, fileName.length() - 3) : fileName;
    return "<!DOCTYPE html>\n"
        + "<html>\n"
        + "<head>\n"
        + "  <meta charset=\"UTF-8\">\n"
        + "  <meta name=\"original-filename\" content=\"" + fileName + "\">\n"
        + "  <meta " + MARKDOWN_MARKER + ">\n"
        + "  <title>" + title + "</title>\n"
        + "</head>\n"
        + "<body>\n"
        + markdownConverter.toHtml(markdown)
        + "</body>\n"
        + "</html>";
  }

  private String htmlDocumentToMarkdown(String html) {
    if (html == null || !html.contains(MARKDOWN_MARKER)) {
      return html;
    }
    Matcher body = BODY.matcher(html);
    if (!body.find()) {
      return html;
    }
    return markdownConverter.toMarkdown(body.group(1).strip()).strip() + "\n";
  }
}
