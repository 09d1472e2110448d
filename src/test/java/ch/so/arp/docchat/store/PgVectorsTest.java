package ch.so.arp.docchat.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PgVectorsTest {

    @Test
    void writesPgvectorLiteral() {
        assertThat(PgVectors.toLiteral(new float[] { 0.5f, -1.0f, 1.0E-7f })).isEqualTo("[0.5,-1.0,1.0E-7]");
    }

    @Test
    void parsesLiteralWrittenByPostgres() {
        assertThat(PgVectors.parse("[0.5,-1,1e-07]")).containsExactly(0.5f, -1.0f, 1.0E-7f);
        assertThat(PgVectors.parse(" [ 1 , 2 ] ")).containsExactly(1f, 2f);
    }

    @Test
    void rejectsMalformedLiteral() {
        assertThatThrownBy(() -> PgVectors.parse("1,2,3")).isInstanceOf(IllegalArgumentException.class);
    }
}
