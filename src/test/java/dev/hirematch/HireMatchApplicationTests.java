package dev.hirematch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HireMatchApplicationTests {

  @Mock
  private AnalysisRunner analysisRunner;

  @Mock
  private ExitManager exitManager;

  @Test
  void shouldRunAnalysisAndExitSuccessfully() {
    HireMatchApplication app = new HireMatchApplication(analysisRunner, exitManager);

    when(analysisRunner.execute()).thenReturn(null);

    app.run();

    verify(analysisRunner).execute();
    verify(exitManager).exit(0);
  }

  @Test
  void shouldExitWithErrorWhenAnalysisFails() {
    HireMatchApplication app = new HireMatchApplication(analysisRunner, exitManager);

    when(analysisRunner.execute()).thenThrow(new IllegalStateException("Property 'analysis.job-file' is not set"));

    app.run();

    verify(exitManager).exit(1);
  }
}
