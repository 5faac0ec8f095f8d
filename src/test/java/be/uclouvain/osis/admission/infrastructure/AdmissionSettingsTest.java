package be.uclouvain.osis.admission.infrastructure;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AdmissionSettingsTest {
  @AfterEach
  void tearDown() {
    System.clearProperty(AdmissionSettings.MAX_PROPOSITIONS);
    System.clearProperty(AdmissionSettings.NOMA_SEQUENCE);
  }

  @Test
  void defaults_match_the_bundled_file() {
    final var defaults = AdmissionSettings.defaults();

    assertEquals(5, defaults.maximumPropositionsParCandidat());
    assertEquals("noma", defaults.sequenceNoma());
    assertEquals(2, defaults.taillePoolAsynchrone());
    assertEquals(defaults, AdmissionSettings.load());
  }

  @Test
  void system_properties_override_the_file() {
    System.setProperty(AdmissionSettings.MAX_PROPOSITIONS, " 7 ");
    System.setProperty(AdmissionSettings.NOMA_SEQUENCE, "noma_fc");

    final var settings = AdmissionSettings.load();

    assertEquals(7, settings.maximumPropositionsParCandidat());
    assertEquals("noma_fc", settings.sequenceNoma());
  }

  @Test
  void non_numeric_value_is_rejected() {
    System.setProperty(AdmissionSettings.MAX_PROPOSITIONS, "cinq");

    assertThrows(IllegalArgumentException.class, AdmissionSettings::load);
  }

  @Test
  void out_of_range_values_are_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new AdmissionSettings(0, "noma", 2));
    assertThrows(IllegalArgumentException.class, () -> new AdmissionSettings(5, " ", 2));
    assertThrows(IllegalArgumentException.class, () -> new AdmissionSettings(5, "noma", 0));
  }
}
