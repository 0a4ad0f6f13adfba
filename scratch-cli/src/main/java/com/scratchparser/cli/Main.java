package com.scratchparser.cli;

public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(ScratchCli.run(args, System.out, System.err));
    }
}
