package com.jcas.parser;

import com.jcas.error.ParityException;
import com.jcas.error.UnexpectedTokenException;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer(new Session().tables());

    @Test
    public void testBracketsBecomeGroups() {
        MutableList<Token> tokens = tokenizer.tokenize("2*(x+1)");
        assertEquals(3, tokens.size());
        assertEquals(Token.Type.NUMBER, tokens.get(0).type());
        assertEquals("2", tokens.get(0).text());
        assertEquals(Token.Type.OPERATOR, tokens.get(1).type());
        Token group = tokens.get(2);
        assertTrue(group.isGroup(Bracket.Kind.GROUP));
        assertEquals(2, group.position());
        assertEquals(3, group.children().size());
        assertEquals("x", group.children().get(0).text());
    }

    @Test
    public void testSquareBracketsAndCommas() {
        MutableList<Token> tokens = tokenizer.tokenize("[1, y]");
        assertEquals(1, tokens.size());
        MutableList<Token> children = tokens.get(0).children();
        assertEquals(3, children.size());
        assertEquals(Token.Type.COMMA, children.get(1).type());
        assertEquals(Token.Type.IDENTIFIER, children.get(2).type());
    }

    @ParameterizedTest
    @CsvSource({
        "12, 12",
        "1.5, 1.5",
        ".25, .25",
        "1.234e+1, 1.234e+1",
        "3E2, 3E2"
    })
    public void testNumberLiterals(String input, String expected) {
        MutableList<Token> tokens = tokenizer.tokenize(input);
        assertEquals(1, tokens.size());
        assertEquals(Token.Type.NUMBER, tokens.get(0).type());
        assertEquals(expected, tokens.get(0).text());
    }

    @Test
    public void testExponentMarkerWithoutDigitsIsAnIdentifier() {
        MutableList<Token> tokens = tokenizer.tokenize("2e");
        assertEquals(2, tokens.size());
        assertEquals(Token.Type.IDENTIFIER, tokens.get(1).type());
        assertEquals("e", tokens.get(1).text());
    }

    @Test
    public void testIdentifiers() {
        MutableList<Token> tokens = tokenizer.tokenize("x_1 + alpha2");
        assertEquals("x_1", tokens.get(0).text());
        assertEquals("alpha2", tokens.get(2).text());
    }

    @Test
    public void testUnbalancedBrackets() {
        assertThrows(ParityException.class, () -> tokenizer.tokenize("(x+1"));
        assertThrows(ParityException.class, () -> tokenizer.tokenize("x+1)"));
        assertThrows(ParityException.class, () -> tokenizer.tokenize("(x]"));
    }

    @Test
    public void testUnknownCharacter() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> tokenizer.tokenize("x @ y"));
        assertTrue(e.getMessage().contains("position 2"), e.getMessage());
    }
}
