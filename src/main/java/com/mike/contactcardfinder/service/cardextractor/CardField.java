package com.mike.contactcardfinder.service.cardextractor;

public enum CardField {
    NAME,
    EMAIL,
    PHONE,
    SIP,
    ADDRESS,
    DEPARTMENT,
    COMPANY,
    OFFICE
}
