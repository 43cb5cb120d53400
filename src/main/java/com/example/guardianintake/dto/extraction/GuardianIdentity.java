package com.example.guardianintake.dto.extraction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GuardianIdentity {
    private String name;
    private String dateOfBirth;
    private String phone;
    private String email;
    private String address;
    private String relationship;

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public boolean isEmpty() {
        return !hasName() && isBlank(dateOfBirth) && isBlank(phone) && isBlank(email)
            && isBlank(address) && isBlank(relationship);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
