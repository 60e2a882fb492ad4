package scriptsync.platform.adapters.markdown;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;
import java.util.List;
import org.commonmark.Extension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import scriptsync.core.transform.MarkdownConverter;

/** commonmark renders Markdown; flexmark's html2md converter reads the HTML back. */
public class CommonmarkMarkdownConverter implements MarkdownConverter {
  private static final List<Extension> EXTENSIONS = List.of(TablesExtension.create());

  private final Parser parser = Parser.builder().extensions(EXTENSIONS).build();
  private final HtmlRenderer renderer = HtmlRenderer.builder().extensions(EXTENSIONS).build();
  private final FlexmarkHtmlConverter htmlConverter =
      FlexmarkHtmlConverter.builder(
              new MutableDataSet().set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false))
          .build();

  @Override
  public String toHtml(String markdown) {
    if (markdown == null || markdown.isBlank()) {
      return "";
    }
    Node document = parser.parse(markdown);
    return renderer.render(document);
  }

  @Override
  public String toMarkdown(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    return htmlConverter.convert(html);
  }
}
