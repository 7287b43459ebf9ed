package max.reversi.engine.utils.notations;

import max.reversi.engine.common.TilePos;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TileNotationTest {

    @ParameterizedTest
    @ValueSource(strings = {"D3", "d3", "3D", "3d", " D3\n"})
    public void parseShouldAcceptBothOrdersAndCases(String input) {
        assertEquals(Optional.of(TilePos.at(2, 3)), TileNotation.parse(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "D", "I1", "A9", "A0", "A10", "DD", "33", "D3x"})
    public void parseShouldRejectAnythingElse(String input) {
        assertTrue(TileNotation.parse(input).isEmpty());
    }

    @Test
    public void parseShouldRejectNull() {
        assertTrue(TileNotation.parse(null).isEmpty());
    }

    @Test
    public void writeShouldUseColumnLetterThenRowNumber() {
        assertEquals("A1", TileNotation.write(TilePos.at(0, 0)));
        assertEquals("H8", TileNotation.write(TilePos.at(7, 7)));
        assertEquals("E3", TileNotation.write(TilePos.at(2, 4)));
    }
}
