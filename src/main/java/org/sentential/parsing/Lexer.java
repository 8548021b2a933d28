package org.sentential.parsing;

import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Scanner;
import java.util.regex.Pattern;

/**
 * Splits formula text into symbols.
 *
 * Glyphs are read back as the printer writes them, so "∨" is a conjunction and "∧" a disjunction.
 * The ASCII and word forms follow the operator's meaning: "&amp;" and "and" are conjunctions,
 * "|" and "or" disjunctions.
 */
public class Lexer {

    private Scanner input;

    private int symbol = NONE;
    private String currentToken   = "";

    public static final int EOF      = -1;
    public static final int VARIABLE = 999;
    public static final int UNKNOWN  = 998;

    public static final int NONE  = 0;

    public static final int OR      = 1;
    public static final int AND     = 2;
    public static final int NOT     = 3;
    public static final int IMPLIES = 4;

    public static final int LEFT  = 6;
    public static final int RIGHT = 7;

    private static final Pattern SEPARATOR = Pattern.compile("[\\s,;]+");
    // multi character operators first
    private static final Pattern OPERATOR = Pattern.compile("(=>|->|[()¬!~∧&∨|⇒])");

    private static final HashMap<String, Integer> stringToCode = generateStringToCode();
    private static HashMap<String, Integer> generateStringToCode(){
        HashMap<String, Integer> hm = new HashMap<String, Integer>();

        hm.put("(", LEFT);
        hm.put(")", RIGHT);

        hm.put("∨", AND);
        hm.put("&", AND);
        hm.put("and", AND);

        hm.put("∧", OR);
        hm.put("|", OR);
        hm.put("or", OR);

        hm.put("¬", NOT);
        hm.put("!", NOT);
        hm.put("~", NOT);
        hm.put("not", NOT);

        hm.put("⇒", IMPLIES);
        hm.put("=>", IMPLIES);
        hm.put("->", IMPLIES);
        hm.put("implies", IMPLIES);
        return hm;
    }

    public Lexer(String s) {
        input = new Scanner(processInputString(s));
        input.useDelimiter(SEPARATOR);
    }

    public int nextSymbol() {
        // the delimiter swallows runs of separators, blank tokens only appear at the start
        do {
            if(!input.hasNext()){
                this.currentToken = "";
                this.symbol = EOF;
                return EOF;
            }
            this.currentToken = input.next();
        } while (StringUtils.isBlank(this.currentToken));

        String lcToken = this.currentToken.toLowerCase();
        if(stringToCode.containsKey(lcToken)){
            symbol = stringToCode.get(lcToken);
        }
        else if(lcToken.length() == 1 && Character.isLetter(lcToken.charAt(0))){
            symbol = VARIABLE;
        }
        else{
            symbol = UNKNOWN;
        }
        return symbol;
    }

    public static List<Integer> tokenize(String inputString){
        // create a new lexer so as not to reset this one
        Lexer temp = new Lexer(inputString);
        List<Integer> symbols = new ArrayList<Integer>();
        int symbol;
        while ( (symbol = temp.nextSymbol()) != Lexer.EOF){
            symbols.add(symbol);
        }
        return symbols;
    }

    public String toString() {
        return this.currentToken;
    }

    private String processInputString(String s) {
        if(s == null){
            return "";
        }
        // operators and parens become separate tokens
        return OPERATOR.matcher(s.trim()).replaceAll(" $1 ").trim();
    }
}
