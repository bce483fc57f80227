package com.gaussjordan;

/** Console front-end settings. */
public final class StepperOptions {
    public final boolean runAll;        // no prompting, print every step
    public final boolean printLog;      // dump the step log at the end
    public final int decimals;          // digits after the point when rendering
    public final String inputPath;      // null = standard input

    private StepperOptions(Builder b) {
        this.runAll = b.runAll;
        this.printLog = b.printLog;
        this.decimals = b.decimals;
        this.inputPath = b.inputPath;
    }

    public boolean readsStdin() { return inputPath == null; }

    public static final class Builder {
        private boolean runAll, printLog;
        private int decimals = MatrixRenderer.DEFAULT_DECIMALS;
        private String inputPath;

        public Builder runAll(boolean v){ this.runAll=v; return this; }
        public Builder printLog(boolean v){ this.printLog=v; return this; }
        public Builder decimals(int v){
            if (v < 0 || v > 10) throw new IllegalArgumentException("-decimals must be in 0..10, got " + v);
            this.decimals=v; return this;
        }
        public Builder inputPath(String p){ this.inputPath = "-".equals(p) ? null : p; return this; }
        public StepperOptions build(){ return new StepperOptions(this); }
    }
}
