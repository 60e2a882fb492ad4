package scriptsync.platform.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import scriptsync.core.breadcrumb.BreadcrumbCodec;
import scriptsync.core.breadcrumb.BreadcrumbRegistry;
import scriptsync.core.transform.ContentTransformer;
import scriptsync.core.transform.GitFileShim;
import scriptsync.core.transform.MarkdownConverter;
import scriptsync.platform.adapters.markdown.CommonmarkMarkdownConverter;

@Configuration
public class TransformConfig {
  @Bean
  public MarkdownConverter markdownConverter() {
    return new CommonmarkMarkdownConverter();
  }

  @Bean
  public GitFileShim gitFileShim(ObjectMapper objectMapper) {
    return new GitFileShim(objectMapper);
  }

  @Bean
  public ContentTransformer contentTransformer(
      MarkdownConverter markdownConverter, GitFileShim gitFileShim) {
    return new ContentTransformer(markdownConverter, gitFileShim);
  }

  @Bean
  public BreadcrumbRegistry breadcrumbRegistry(GitFileShim gitFileShim) {
    return new BreadcrumbRegistry(new BreadcrumbCodec(), gitFileShim);
  }
}
