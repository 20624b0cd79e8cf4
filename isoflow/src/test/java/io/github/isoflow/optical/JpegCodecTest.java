package io.github.isoflow.optical;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;

class JpegCodecTest {

  private final JpegCodec codec = new JpegCodec();

  @Test
  void encode_decode() {
    final BufferedImage image = new BufferedImage(32, 16, BufferedImage.TYPE_INT_RGB);

    final byte[] bytes = codec.encode(image);

    assertThat(bytes[0]).isEqualTo((byte) 0xff);
    assertThat(bytes[1]).isEqualTo((byte) 0xd8);
    final BufferedImage decoded = codec.decode(bytes);
    assertThat(decoded.getWidth()).isEqualTo(32);
    assertThat(decoded.getHeight()).isEqualTo(16);
  }

  @Test
  void decode_unsupported() {
    assertThatThrownBy(() -> codec.decode(new byte[]{1, 2, 3}))
        .isInstanceOf(IllegalArgumentException.class);
  }

}
