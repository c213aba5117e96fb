package com.vtb.parity.evaluator;

/**
 * Воркер, который не сообщает о готовности
 */
public class NeverReadyWorkerMain {

    public static void main(String[] args) throws InterruptedException {
        Thread.sleep(60_000);
    }
}
