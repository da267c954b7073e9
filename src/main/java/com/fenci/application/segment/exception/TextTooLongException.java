package com.fenci.application.segment.exception;

public class TextTooLongException extends RuntimeException {

    public TextTooLongException(int length, int maxLength) {
        super(String.format("Text is %d characters long, the maximum is %d.", length, maxLength));
    }
}
