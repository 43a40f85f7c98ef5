package com.mike.contactcardfinder.dto;

import lombok.Builder;
import lombok.Value;

import java.util.stream.Stream;

@Value
@Builder(toBuilder = true)
public class ContactInfo {
    String name;
    String personalEmail;
    String phone;
    String sip;
    String address;
    String department;
    String company;
    String officeLocation;

    public static ContactInfo empty() {
        return ContactInfo.builder().build();
    }

    public boolean hasAnyField() {
        return Stream.of(name, personalEmail, phone, sip, address, department, company, officeLocation)
                .anyMatch(v -> v != null && !v.isBlank());
    }
}
