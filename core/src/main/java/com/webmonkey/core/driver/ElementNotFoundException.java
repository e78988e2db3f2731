package com.webmonkey.core.driver;

public class ElementNotFoundException extends DriverException {
    public ElementNotFoundException(String selector) {
        super("element not found: " + selector);
    }
}
