package com.figsearchharness;

import java.nio.file.Paths;
import java.util.*;

public final class OptionsParser {

    private OptionsParser(){}

    public static HarnessConfig parse(String[] args){
        HarnessConfig.Builder b = new HarnessConfig.Builder();
        String program = null;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-functional": b.mode(HarnessConfig.Mode.FUNCTIONAL); break;   // default
                case "-time": b.mode(HarnessConfig.Mode.TIMED); break;
                case "-random": b.randomValidity(true); break;
                case "-whitespace": b.whitespaceFuzz(true); break;
                case "-verbose": b.verbose(true); break;
                case "-batch": b.interactive(false); break;
                case "-seed": b.seed(Long.parseLong(value(args, ++i, a))); break;
                case "-trials": b.trials(Integer.parseInt(value(args, ++i, a))); break;
                case "-width": b.width(Integer.parseInt(value(args, ++i, a))); break;
                case "-height": b.height(Integer.parseInt(value(args, ++i, a))); break;
                case "-maxdim": b.maxDimension(Integer.parseInt(value(args, ++i, a))); break;
                case "-timeout": b.timeoutSeconds(Long.parseLong(value(args, ++i, a))); break;
                case "-scratch": b.scratchDir(Paths.get(value(args, ++i, a))); break;
                case "-queries": {
                    for (String tok : nextCSV(value(args, ++i, a))) b.addQuery(Query.parse(tok));
                    break;
                }
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (program != null) throw new IllegalArgumentException("Multiple programs: " + a);
                    program = a;
            }
        }
        if (program == null) throw new IllegalArgumentException("Missing program under test");
        return b.program(Paths.get(program)).build();
    }

    private static String value(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Option " + option + " needs a value");
        return args[i];
    }

    private static List<String> nextCSV(String s){
        String[] parts = s.split(",");
        List<String> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
