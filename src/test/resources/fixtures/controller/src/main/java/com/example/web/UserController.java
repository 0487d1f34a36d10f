package com.example.web;

import org.springframework.web.bind.annotation.RestController;

@RestController
public class UserController {

    @Deprecated
    public String old() {
        return helper();
    }

    private String helper() {
        return "legacy";
    }

    @Deprecated
    public String stillCalled() {
        return "v1";
    }

    public String live() {
        return "live";
    }
}
