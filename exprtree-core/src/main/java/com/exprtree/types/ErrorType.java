package com.exprtree.types;

public enum ErrorType implements Type {
    INSTANCE;

    @Override
    public String getString() {
        return "<<error type>>";
    }

    @Override
    public boolean isError() {
        return true;
    }
}
