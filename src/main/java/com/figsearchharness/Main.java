package com.figsearchharness;

public class Main {

    public static void main(String[] args) {
        int code = new HarnessDriver().run(args);
        System.exit(code);
    }
}
