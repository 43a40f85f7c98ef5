package com.mike.contactcardfinder.service.behavior;

public enum DelayCategory {
    BETWEEN_ACTIONS,
    BETWEEN_RECORDS,
    AFTER_TYPING,
    AFTER_CLICK,
    AFTER_CARD_CLOSE,
    CARD_LOAD
}
