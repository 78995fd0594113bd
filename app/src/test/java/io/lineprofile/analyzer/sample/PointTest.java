package io.lineprofile.analyzer.sample;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PointTest {

    @Test
    void parsesCommaSeparatedCoordinates() {
        assertThat(Point.parse("1454,627")).isEqualTo(new Point(1454, 627));
        assertThat(Point.parse(" 3 , -2 ")).isEqualTo(new Point(3, -2));
    }

    @Test
    void rejectsMalformedInput() {
        assertThatThrownBy(() -> Point.parse("12")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Point.parse("1,2,3")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Point.parse("a,b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("integers");
    }
}
