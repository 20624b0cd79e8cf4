package io.github.isoflow.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class IsotopeGenerationConfigTest {

  private IsotopeGenerationConfig config(final double sigma, final String polarity, final int charges) {
    return ImmutableIsotopeGenerationConfig.builder()
        .adducts(List.of("-H"))
        .charge(ImmutableCharge.builder().polarity(polarity).nCharges(charges).build())
        .isocalcSigma(sigma)
        .isocalcPtsPerMz(8078)
        .build();
  }

  @Test
  void roundedSigma_halfUp() {
    assertThat(config(0.0006195, "+", 1).roundedSigma()).isEqualTo(new BigDecimal("0.000620"));
    assertThat(config(0.00061949, "+", 1).roundedSigma()).isEqualTo(new BigDecimal("0.000619"));
  }

  @Test
  void chargeDescriptor() {
    assertThat(config(0.01, "-", 2).chargeDescriptor()).isEqualTo("-2");
  }

}
