package chalk.chc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import chalk.chc.common.exceptions.InvalidOptionException;
import chalk.chc.frontend.AnalysisOptions;

public class SettingsTest {

  @After
  public void resetSettings() {
    Settings.set(Settings.STRICT_CONDITIONS, "false");
    Settings.set(Settings.STRICT_RETURNS, "false");
    Settings.set(Settings.REJECT_REDEFINITION, "false");
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertFalse(Settings.getBoolean(Settings.STRICT_CONDITIONS));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertTrue(Settings.getKeys().contains(Settings.REJECT_REDEFINITION));

    AnalysisOptions opts = AnalysisOptions.fromSettings();
    assertFalse(opts.strictConditions);
    assertFalse(opts.strictReturns);
    assertFalse(opts.rejectRedefinition);
  }

  @Test
  public void testAnalysisOptionsFromSettings()
      throws InvalidOptionException {
    Settings.set(Settings.STRICT_RETURNS, "TRUE");
    Settings.set(Settings.REJECT_REDEFINITION, "true");
    AnalysisOptions opts = AnalysisOptions.fromSettings();
    assertFalse(opts.strictConditions);
    assertTrue("Case insensitive", opts.strictReturns);
    assertTrue(opts.rejectRedefinition);
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.STRICT_CONDITIONS, "yes");
    Settings.getBoolean(Settings.STRICT_CONDITIONS);
  }

  @Test(expected=InvalidOptionException.class)
  public void testUnknownKey() throws InvalidOptionException {
    Settings.getBoolean("chc.no.such.option");
  }
}
