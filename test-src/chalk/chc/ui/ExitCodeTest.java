package chalk.chc.ui;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class ExitCodeTest {

  @Test
  public void testCodes() {
    assertEquals(Arrays.asList(ExitCode.SUCCESS, ExitCode.ERROR_IO,
                               ExitCode.ERROR_USER, ExitCode.ERROR_COMMAND,
                               ExitCode.ERROR_INTERNAL),
                 Arrays.asList(ExitCode.values()));
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.ERROR_IO.code());
    assertEquals(4, ExitCode.ERROR_USER.code());
    assertEquals(5, ExitCode.ERROR_COMMAND.code());
    assertEquals(90, ExitCode.ERROR_INTERNAL.code());
  }
}
