package org.metricshub.jbasic;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jbasic.jrt.BasicPrinter;
import org.metricshub.jbasic.jrt.BasicString;

public class BasicPrinterTest {

	private ByteArrayOutputStream out;
	private BasicPrinter printer;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		printer = new BasicPrinter(new PrintStream(out, true));
	}

	private String output() {
		printer.flush();
		return new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
	}

	@Test
	public void testColumnFollowsPrintedBytes() {
		printer.print(BasicString.of("ABC"));
		assertEquals(3, printer.getColumn());
		printer.printNumber(-12);
		assertEquals(6, printer.getColumn());
		printer.newline();
		assertEquals(0, printer.getColumn());
		assertEquals("ABC-12\n", output());
	}

	@Test
	public void testBackspaceMovesColumnBack() {
		printer.print('A');
		printer.print(8);
		assertEquals(0, printer.getColumn());
		printer.print(8);
		assertEquals(0, printer.getColumn());
	}

	@Test
	public void testCommaGoesToNextTabStop() {
		printer.print('A');
		printer.printTab();
		assertEquals(BasicPrinter.TAB_WIDTH, printer.getColumn());
		printer.printTab();
		assertEquals(2 * BasicPrinter.TAB_WIDTH, printer.getColumn());
		assertEquals("A\t\t", output());
	}

	@Test
	public void testTabPadsWithSpaces() {
		printer.print('A');
		printer.tab(4);
		assertEquals(4, printer.getColumn());
		printer.tab(2);
		assertEquals(4, printer.getColumn());
		printer.print('\t');
		assertEquals(BasicPrinter.TAB_WIDTH, printer.getColumn());
		assertEquals("A" + "   " + "    ", output());
	}

	@Test
	public void testResetColumn() {
		printer.print(BasicString.of("PROMPT? "));
		printer.resetColumn();
		assertEquals(0, printer.getColumn());
	}
}
