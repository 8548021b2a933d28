package org.sentential.parsing;

import org.sentential.TruthTable;
import org.sentential.ast.Expression;
import org.sentential.errors.ParserError;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads formulas from stdin and prints their truth tables.
 */
public class InteractiveConsole {

    public static void main(String[] args) throws IOException {

        final char missingVariable = System.getProperty("sentential.missingVariable", "?").charAt(0);
        final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        String prompt = "Please enter a formula:";
        String userInput = getUserInput(in, prompt);
        while (!userInput.equals("exit") && !userInput.isEmpty())
        {
            RecursiveDescentParser parser = new RecursiveDescentParser(new Lexer(userInput), missingVariable);
            Expression ast = parser.parse();
            System.out.println("Parsed: " + ast);
            for (ParserError error : parser.getErrors()) {
                System.out.println("*** " + error.getMessage() + " ***");
            }
            System.out.println(TruthTable.of(ast).format());

            userInput = getUserInput(in, prompt);
        }
    }

    private static String getUserInput(BufferedReader in, String prompt) throws IOException {
        System.out.println(prompt);
        String line = in.readLine();
        return line == null ? "" : line.trim();
    }
}
