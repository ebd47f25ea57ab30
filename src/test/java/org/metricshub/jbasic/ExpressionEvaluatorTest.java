package org.metricshub.jbasic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.ErrorKind;

public class ExpressionEvaluatorTest {

	private static void assertError(ErrorKind kind, String expression) {
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> Basic.eval(expression));
		assertEquals(expression, kind, e.getKind());
	}

	@Test
	public void testPrecedence() {
		assertEquals(14, Basic.eval("2 + 3 * 4"));
		assertEquals(20, Basic.eval("(2 + 3) * 4"));
		assertEquals(5, Basic.eval("10 - 2 - 3"));
		assertEquals(1, Basic.eval("2 + 3 > 4"));
	}

	@Test
	public void testNegativeLiterals() {
		assertEquals(-6, Basic.eval("2 * -3"));
		assertEquals(2, Basic.eval("5-3"));
		assertEquals(8, Basic.eval("5 - -3"));
	}

	@Test
	public void testTruncatingDivision() {
		assertEquals(3, Basic.eval("7 / 2"));
		assertEquals(-3, Basic.eval("-7 / 2"));
		assertEquals(-1, Basic.eval("-7 MOD 2"));
		assertEquals(1, Basic.eval("7 % 3"));
	}

	@Test
	public void testDivisionIdentity() {
		int[] values = { 17, -17, 5, -5, 1, 0, 123456 };
		int[] divisors = { 3, -3, 7, -1, 1000 };
		for (int a : values) {
			for (int b : divisors) {
				String expression = "(" + a + " / " + b + ") * " + b + " + " + a + " MOD " + b;
				assertEquals(expression, a, Basic.eval(expression));
			}
		}
	}

	@Test
	public void testDivisionByZero() {
		assertError(ErrorKind.DIVISION_BY_ZERO, "1 / 0");
		assertError(ErrorKind.DIVISION_BY_ZERO, "1 MOD (2 - 2)");
	}

	@Test
	public void testBitwise() {
		assertEquals(2, Basic.eval("6 AND 3"));
		assertEquals(7, Basic.eval("6 OR 3"));
		assertEquals(2, Basic.eval("6 & 3"));
		assertEquals(7, Basic.eval("6 | 3"));
	}

	@Test
	public void testComparisons() {
		assertEquals(1, Basic.eval("1 < 2"));
		assertEquals(0, Basic.eval("2 < 1"));
		assertEquals(1, Basic.eval("2 <= 2"));
		assertEquals(1, Basic.eval("2 >= 2"));
		assertEquals(1, Basic.eval("1 <> 2"));
		assertEquals(0, Basic.eval("1 = 2"));
	}

	@Test
	public void testComparisonsChainFromLeftToRight() {
		assertEquals(1, Basic.eval("1 < 2 < 3"));
		assertEquals(0, Basic.eval("3 > 2 > 1"));
	}

	@Test
	public void testStringComparisons() {
		assertEquals(1, Basic.eval("\"ABC\" < \"ABD\""));
		assertEquals(1, Basic.eval("\"AB\" < \"ABC\""));
		assertEquals(0, Basic.eval("\"B\" < \"ABC\""));
		assertEquals(1, Basic.eval("\"ABC\" = \"ABC\""));
		assertEquals(1, Basic.eval("\"\" < \"A\""));
	}

	@Test
	public void testConcatenation() {
		assertEquals("ABC", Basic.eval("\"AB\" + \"C\""));
		assertEquals("", Basic.eval("\"\" + \"\""));
	}

	@Test
	public void testMixedTypes() {
		assertError(ErrorKind.TYPE_MISMATCH, "1 + \"A\"");
		assertError(ErrorKind.TYPE_MISMATCH, "\"A\" + 1");
		assertError(ErrorKind.TYPE_MISMATCH, "\"A\" - \"B\"");
		assertError(ErrorKind.TYPE_MISMATCH, "\"A\" * 2");
		assertError(ErrorKind.TYPE_MISMATCH, "\"A\" < 2");
	}

	@Test
	public void testIntegerFunctions() {
		assertEquals(5, Basic.eval("ABS(-5)"));
		assertEquals(5, Basic.eval("ABS(5)"));
		assertEquals(9, Basic.eval("INT(9)"));
		assertEquals(-1, Basic.eval("SGN(-9)"));
		assertEquals(1, Basic.eval("SGN(9)"));
		assertEquals(0, Basic.eval("SGN(0)"));
		assertEquals(5, Basic.eval("LEN(\"HELLO\")"));
		assertEquals(72, Basic.eval("CODE(\"HELLO\")"));
		assertEquals(0, Basic.eval("CODE(\"\")"));
	}

	@Test
	public void testVal() {
		assertEquals(123, Basic.eval("VAL(\"123\")"));
		assertEquals(-42, Basic.eval("VAL(\"-42\")"));
		assertError(ErrorKind.TYPE_MISMATCH, "VAL(\"12A\")");
		assertError(ErrorKind.TYPE_MISMATCH, "VAL(\"\")");
		assertError(ErrorKind.TYPE_MISMATCH, "VAL(\"-\")");
		assertError(ErrorKind.TYPE_MISMATCH, "VAL(12)");
	}

	@Test
	public void testSubstrings() {
		assertEquals("HE", Basic.eval("LEFT$(\"HELLO\", 2)"));
		assertEquals("HI", Basic.eval("LEFT$(\"HI\", 10)"));
		assertEquals("ELL", Basic.eval("MID$(\"HELLO\", 2, 3)"));
		assertEquals("LO", Basic.eval("MID$(\"HELLO\", 4, 10)"));
		assertEquals("", Basic.eval("MID$(\"HELLO\", 9, 2)"));
		assertEquals("LO", Basic.eval("RIGHT$(\"HELLO\", 2)"));
		assertEquals("ELLO", Basic.eval("RIGHT$(\"HELLO\", 4)"));
	}

	@Test
	public void testLeftOfZeroIsEmpty() {
		assertEquals("", Basic.eval("LEFT$(\"HELLO\", 0)"));
		assertEquals("", Basic.eval("LEFT$(\"\", 0)"));
	}

	@Test
	public void testMidOfWholeStringIsIdentity() {
		assertEquals("HELLO", Basic.eval("MID$(\"HELLO\", 1, LEN(\"HELLO\"))"));
		assertEquals("", Basic.eval("MID$(\"\", 1, LEN(\"\"))"));
	}

	@Test
	public void testRightOfWholeStringIsEmpty() {
		assertEquals("", Basic.eval("RIGHT$(\"HELLO\", 5)"));
		assertEquals("", Basic.eval("RIGHT$(\"HELLO\", 6)"));
	}

	@Test
	public void testChr() {
		assertEquals(2, Basic.eval("LEN(CHR$(65))"));
		assertEquals(65, Basic.eval("CODE(CHR$(65))"));
		assertEquals("A\u0000", Basic.eval("CHR$(65)"));
	}

	@Test
	public void testFunctionSignatures() {
		assertError(ErrorKind.TYPE_MISMATCH, "LEN(5)");
		assertError(ErrorKind.TYPE_MISMATCH, "ABS(\"A\")");
		assertError(ErrorKind.TYPE_MISMATCH, "LEFT$(2, \"A\")");
		assertError(ErrorKind.SYNTAX, "LEFT$(\"A\")");
		assertError(ErrorKind.SYNTAX, "ABS 5");
	}

	@Test
	public void testRnd() {
		assertEquals(3, Basic.eval("RND(10)"));
		assertEquals(0, Basic.eval("RND(0)"));
		assertEquals(0, Basic.eval("RND(-4)"));
	}

	@Test
	public void testPeekWithoutHostMemory() {
		assertError(ErrorKind.HOST_MEMORY, "PEEK(0)");
	}

	@Test
	public void testVariablesAreUnset() {
		assertEquals(0, Basic.eval("A + B"));
		assertEquals("", Basic.eval("A$"));
		assertEquals(0, Basic.eval("A(3)"));
	}

	@Test
	public void testSyntaxErrors() {
		assertError(ErrorKind.SYNTAX, "(1 + 2");
		assertError(ErrorKind.SYNTAX, "1 + ");
		assertError(ErrorKind.SYNTAX, "1 2");
		assertError(ErrorKind.SYNTAX, "\"ABC");
	}
}
