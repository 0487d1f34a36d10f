package com.example.cleanup;

public class TestCleanupTest {

    void run() {
        new TestCleanup().testMethod();
    }
}
