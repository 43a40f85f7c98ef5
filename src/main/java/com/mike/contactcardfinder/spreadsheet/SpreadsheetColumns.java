package com.mike.contactcardfinder.spreadsheet;

import com.mike.contactcardfinder.dto.ContactInfo;

import java.util.List;
import java.util.function.Function;

/**
 * Fixed layout of the result columns, 1-based.
 */
public enum SpreadsheetColumns {
    EMAIL(1, "Email", null),
    STATUS(2, "Status", null),
    NAME(3, "Name", ContactInfo::getName),
    PERSONAL_EMAIL(4, "PersonalEmail", ContactInfo::getPersonalEmail),
    PHONE(5, "Phone", ContactInfo::getPhone),
    SIP(6, "SIP", ContactInfo::getSip),
    ADDRESS(7, "Address", ContactInfo::getAddress),
    DEPARTMENT(8, "Department", ContactInfo::getDepartment),
    COMPANY(9, "Company", ContactInfo::getCompany),
    OFFICE_LOCATION(10, "OfficeLocation", ContactInfo::getOfficeLocation);

    private final int column;
    private final String header;
    private final Function<ContactInfo, String> accessor;

    SpreadsheetColumns(int column, String header, Function<ContactInfo, String> accessor) {
        this.column = column;
        this.header = header;
        this.accessor = accessor;
    }

    public int column() {
        return column;
    }

    public String header() {
        return header;
    }

    public String valueOf(ContactInfo info) {
        if (accessor == null || info == null) return null;
        return accessor.apply(info);
    }

    public static List<SpreadsheetColumns> dataColumns() {
        return List.of(NAME, PERSONAL_EMAIL, PHONE, SIP, ADDRESS, DEPARTMENT, COMPANY, OFFICE_LOCATION);
    }
}
