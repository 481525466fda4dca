package com.flamingo.ai.legaldoc;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.legaldoc.service.analysis.AnalysisService;
import com.flamingo.ai.legaldoc.service.analysis.DocumentAnalysisOrchestrator;
import com.flamingo.ai.legaldoc.service.document.DocumentService;
import com.flamingo.ai.legaldoc.service.inference.EntityRecognizer;
import com.flamingo.ai.legaldoc.service.inference.QuestionAnsweringModel;
import com.flamingo.ai.legaldoc.service.inference.SummarizationModel;
import com.flamingo.ai.legaldoc.service.job.JobTracker;
import com.flamingo.ai.legaldoc.service.pdf.PdfTextExtractor;
import com.flamingo.ai.legaldoc.service.risk.RiskAssessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads against the in-memory test database. The model
 * server adapters are mocked so no inference service has to be running.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private EntityRecognizer entityRecognizer;
  @MockitoBean private QuestionAnsweringModel questionAnsweringModel;
  @MockitoBean private SummarizationModel summarizationModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(AnalysisService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentAnalysisOrchestrator.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentService.class)).isNotNull();
    assertThat(applicationContext.getBean(JobTracker.class)).isNotNull();
    assertThat(applicationContext.getBean(PdfTextExtractor.class)).isNotNull();
    assertThat(applicationContext.getBean(RiskAssessor.class)).isNotNull();
  }
}
