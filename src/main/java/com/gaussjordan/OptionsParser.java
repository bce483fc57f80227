package com.gaussjordan;

public final class OptionsParser {

    private OptionsParser() {}

    public static StepperOptions parse(String[] args){
        StepperOptions.Builder b = new StepperOptions.Builder();
        boolean sawInput = false;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-all": b.runAll(true); break;
                case "-log": b.printLog(true); break;
                case "-decimals": b.decimals(intValue(a, args, ++i)); break;
                case "-":
                    if (sawInput) throw new IllegalArgumentException("Multiple inputs: " + a);
                    sawInput = true;
                    b.inputPath(a);
                    break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (sawInput) throw new IllegalArgumentException("Multiple inputs: " + a);
                    sawInput = true;
                    b.inputPath(a);
            }
        }
        return b.build();
    }

    private static int intValue(String opt, String[] args, int i){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + opt);
        try {
            return Integer.parseInt(args[i]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad value for " + opt + ": " + args[i], e);
        }
    }
}
