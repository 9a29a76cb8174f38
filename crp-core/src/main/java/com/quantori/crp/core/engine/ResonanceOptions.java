package com.quantori.crp.core.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Switches of the resonance generator. Defaults live in {@code reference.conf} under {@value #CONFIG_PATH}.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class ResonanceOptions {

  public static final String CONFIG_PATH = "crp.resonance";

  /**
   * Lets sulfur settle on a dectet or duodectet when scoring octet deviation.
   */
  @Builder.Default
  boolean allowExpandedOctet = true;
  /**
   * Keeps structures that are isomorphic but not identical to one already found.
   */
  @Builder.Default
  boolean keepIsomorphic = false;
  @Builder.Default
  boolean filterStructures = true;
  /**
   * Generates Clar structures for polycyclic aromatic species instead of the single aromatic form.
   */
  @Builder.Default
  boolean clarStructures = false;
  /**
   * Adds missing hydrogens before isomorphic resonance generation and strips them afterwards.
   */
  @Builder.Default
  boolean saturateHydrogens = false;
  /**
   * Upper bound on the structures one expansion may hold, 0 for no bound.
   */
  @Builder.Default
  int maxStructures = 1000;

  public static ResonanceOptions defaults() {
    return fromConfig(ConfigFactory.load());
  }

  public static ResonanceOptions fromOverrides(Map<String, Object> overrides) {
    return fromConfig(ConfigFactory.parseMap(overrides).withFallback(ConfigFactory.load()));
  }

  public static ResonanceOptions fromConfig(Config config) {
    Config resonance = config.getConfig(CONFIG_PATH);
    ResonanceOptions options = ResonanceOptions.builder()
        .allowExpandedOctet(resonance.getBoolean("allow-expanded-octet"))
        .keepIsomorphic(resonance.getBoolean("keep-isomorphic"))
        .filterStructures(resonance.getBoolean("filter-structures"))
        .clarStructures(resonance.getBoolean("clar-structures"))
        .saturateHydrogens(resonance.getBoolean("saturate-hydrogens"))
        .maxStructures(resonance.getInt("max-structures"))
        .build();
    if (options.maxStructures < 0) {
      throw new IllegalArgumentException(CONFIG_PATH + ".max-structures must not be negative");
    }
    log.debug("Resonance options loaded: {}", options);
    return options;
  }
}
