package com.vtb.parity.evaluator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Воркер, который падает на первом же запросе
 */
public class CrashingWorkerMain {

    public static void main(String[] args) throws IOException {
        System.out.println("{\"ready\":true}");
        System.out.flush();
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        reader.readLine();
        System.exit(3);
    }
}
