package com.example.cleanup;

import java.io.IOException;

public class Untouched {
    private final int unused = 1;
}
