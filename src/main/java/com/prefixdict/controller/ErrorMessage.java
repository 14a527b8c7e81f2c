package com.prefixdict.controller;

public record ErrorMessage(String type, String message) {}
