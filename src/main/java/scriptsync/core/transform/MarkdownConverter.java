package scriptsync.core.transform;

public interface MarkdownConverter {
  /** Renders Markdown into an HTML fragment. */
  String toHtml(String markdown);

  /** Converts an HTML fragment back into Markdown. */
  String toMarkdown(String html);
}
