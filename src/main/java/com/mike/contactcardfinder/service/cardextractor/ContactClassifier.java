package com.mike.contactcardfinder.service.cardextractor;

import com.mike.contactcardfinder.dto.ContactInfo;
import com.mike.contactcardfinder.dto.Status;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether extracted data identifies a real person.
 */
@Component
@RequiredArgsConstructor
public class ContactClassifier {

    private final ExtractionRules rules;

    public Status classify(ContactInfo info) {
        if (info == null) return Status.ERROR;
        return isValid(info) ? Status.SUCCESS : Status.NOT_FOUND;
    }

    public boolean isValid(ContactInfo info) {
        if (info == null) return false;

        boolean hasEmail = present(info.getPersonalEmail());
        if (present(info.getSip())) return true;
        if (hasEmail && !rules.isGenericEmail(info.getPersonalEmail())) return true;
        if (present(info.getPhone())) return true;
        if (present(info.getName()) && hasEmail) return true;
        if (present(info.getAddress())) return true;
        return present(info.getDepartment());
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }
}
