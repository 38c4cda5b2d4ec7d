package com.flamingo.ai.docingest.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docingest.config.IngestConfig;
import com.flamingo.ai.docingest.exception.DocumentProcessingException;
import com.flamingo.ai.docingest.service.chunking.BoundedSplitter;
import com.flamingo.ai.docingest.service.chunking.SectionAwareChunker;
import com.flamingo.ai.docingest.service.chunking.SectionSplitter;
import com.flamingo.ai.docingest.service.extraction.CodeBlockExtractor;
import com.flamingo.ai.docingest.service.model.CodeSnippet;
import com.flamingo.ai.docingest.service.model.IngestionBatch;
import com.flamingo.ai.docingest.service.model.PageContent;
import com.flamingo.ai.docingest.service.model.ProseChunk;
import com.flamingo.ai.docingest.service.title.CodeExampleTitleService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IngestionPreparationServiceTest {

  private static final String ROOT_URL = "https://docs.example.com/guide/";
  private static final String PIP = "pip install doc-ingest --upgrade && doc-ingest --version";
  private static final String DOCKER =
      "docker run --rm -p 8080:8080 ghcr.io/example/doc-ingest:1.0";

  @Mock private CodeExampleTitleService titleService;

  private IngestConfig ingestConfig;
  private SectionAwareChunker chunker;
  private CodeBlockExtractor extractor;

  @BeforeEach
  void setUp() {
    ingestConfig = new IngestConfig();
    chunker = new SectionAwareChunker(new SectionSplitter(), new BoundedSplitter(), ingestConfig);
    extractor = new CodeBlockExtractor(ingestConfig);
  }

  private IngestionPreparationService serviceWithoutTitles() {
    return new IngestionPreparationService(chunker, extractor, Optional.empty());
  }

  private IngestionPreparationService serviceWithTitles() {
    return new IngestionPreparationService(chunker, extractor, Optional.of(titleService));
  }

  private static List<PageContent> pages() {
    return List.of(
        new PageContent(
            ROOT_URL + "install",
            "Install",
            "# Install\nRun the installer.\n```bash\n" + PIP + "\n```\nThat is all."),
        new PageContent(
            ROOT_URL + "docker",
            "Docker",
            "# Docker\nUse the image.\n```\n"
                + DOCKER
                + "\n```\n## Ports\nPort 8080 is exposed."));
  }

  @Test
  void shouldPrepareProseAndCodeForEveryPage() {
    // When
    IngestionBatch batch = serviceWithoutTitles().prepare(ROOT_URL, pages(), false);

    // Then
    assertThat(batch.collectionName()).isEqualTo("https___docs_example_com_guide");
    assertThat(batch.codeCollectionName()).isEqualTo("https___docs_example_com_guide_code");
    assertThat(batch.pagesProcessed()).isEqualTo(2);
    assertThat(batch.contextualTitlesUsed()).isFalse();

    assertThat(batch.proseChunks())
        .extracting(ProseChunk::url, ProseChunk::chunkIndex)
        .containsExactly(
            tuple(ROOT_URL + "install", 0),
            tuple(ROOT_URL + "docker", 0),
            tuple(ROOT_URL + "docker", 1));
    assertThat(batch.proseChunks().get(2).text()).isEqualTo("## Ports\nPort 8080 is exposed.");

    assertThat(batch.codeSnippets()).hasSize(2);
    CodeSnippet pip = batch.codeSnippets().get(0);
    assertThat(pip.embeddingText()).isEqualTo("Code Snippet:\n" + PIP);
    assertThat(pip.rawCode()).isEqualTo(PIP);
    assertThat(pip.language()).isEqualTo("bash");
    assertThat(pip.codeIndex()).isZero();
    assertThat(pip.title()).isEqualTo("Install");
    CodeSnippet docker = batch.codeSnippets().get(1);
    assertThat(docker.codeIndex()).isZero();
    assertThat(docker.language()).isEmpty();
  }

  @Test
  void shouldPrefixGeneratedTitle_whenContextualTitlesRequested() {
    // Given
    when(titleService.generateTitle(PIP, "# Install\nRun the installer.", "That is all."))
        .thenReturn("Installing with pip.");
    when(titleService.generateTitle(
            DOCKER, "# Docker\nUse the image.", "## Ports\nPort 8080 is exposed."))
        .thenReturn("Running the container.");

    // When
    IngestionBatch batch = serviceWithTitles().prepare(ROOT_URL, pages(), true);

    // Then
    assertThat(batch.contextualTitlesUsed()).isTrue();
    assertThat(batch.codeSnippets())
        .extracting(CodeSnippet::embeddingText)
        .containsExactly(
            "Title: Installing with pip.\n\nCode Snippet:\n" + PIP,
            "Title: Running the container.\n\nCode Snippet:\n" + DOCKER);
    assertThat(batch.codeSnippets()).extracting(CodeSnippet::rawCode).containsExactly(PIP, DOCKER);
    verify(titleService).generateTitle(PIP, "# Install\nRun the installer.", "That is all.");
  }

  @Test
  void shouldThrowIllegalState_whenTitlesRequestedWithoutService() {
    assertThatThrownBy(() -> serviceWithoutTitles().prepare(ROOT_URL, pages(), true))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("ingest.code-titles.enabled");
  }

  @Test
  void shouldThrow_whenNoPages() {
    assertThatThrownBy(() -> serviceWithoutTitles().prepare(ROOT_URL, List.of(), false))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("No pages were successfully crawled.")
        .extracting(e -> ((DocumentProcessingException) e).getSource())
        .isEqualTo(ROOT_URL);
    assertThatThrownBy(() -> serviceWithoutTitles().prepare(ROOT_URL, null, false))
        .isInstanceOf(DocumentProcessingException.class);
  }

  @Test
  void shouldThrow_whenNoPageYieldsText() {
    List<PageContent> blankPages =
        List.of(
            new PageContent(ROOT_URL, "Empty", ""), new PageContent(ROOT_URL, "Blank", "  \n"));

    assertThatThrownBy(() -> serviceWithoutTitles().prepare(ROOT_URL, blankPages, false))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("No text extracted to chunk from any page.")
        .extracting(e -> ((DocumentProcessingException) e).getUserMessage())
        .isEqualTo("No text could be extracted");
  }
}
