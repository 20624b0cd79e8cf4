package io.github.isoflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.immutables.value.Value;

/**
 * Parameters controlling theoretical isotope pattern generation, read from the
 * {@code isotope_generation} section of a dataset config.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableIsotopeGenerationConfig.class)
@JsonDeserialize(as = ImmutableIsotopeGenerationConfig.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface IsotopeGenerationConfig {

  /**
   * Number of decimals sigma is compared with.
   */
  int SIGMA_SCALE = 6;

  /**
   * Target adducts.
   *
   * @return the adducts
   */
  List<String> adducts();

  /**
   * Charge.
   *
   * @return the charge
   */
  Charge charge();

  /**
   * Peak width.
   *
   * @return the sigma
   */
  @JsonProperty("isocalc_sigma")
  double isocalcSigma();

  /**
   * Points per m/z resolution.
   *
   * @return the points per m/z
   */
  @JsonProperty("isocalc_pts_per_mz")
  int isocalcPtsPerMz();

  /**
   * Charge descriptor as stored with theoretical peaks, e.g. {@code +1}.
   *
   * @return the descriptor
   */
  @Value.Derived
  @JsonIgnore
  default String chargeDescriptor() {
    return charge().polarity() + charge().nCharges();
  }

  /**
   * Sigma rounded half up to {@link #SIGMA_SCALE} decimals.
   *
   * @return the rounded sigma
   */
  @Value.Derived
  @JsonIgnore
  default BigDecimal roundedSigma() {
    return BigDecimal.valueOf(isocalcSigma()).setScale(SIGMA_SCALE, RoundingMode.HALF_UP);
  }

  /**
   * Polarity and charge count.
   */
  @Value.Immutable
  @JsonSerialize(as = ImmutableCharge.class)
  @JsonDeserialize(as = ImmutableCharge.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  interface Charge {

    /**
     * Either {@code +} or {@code -}.
     *
     * @return the polarity
     */
    String polarity();

    /**
     * Number of charges.
     *
     * @return the count
     */
    @JsonProperty("n_charges")
    int nCharges();
  }

}
