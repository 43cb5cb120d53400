package com.example.guardianintake.dto.extraction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WardIdentity {
    private String firstName;
    private String middleName;
    private String lastName;
    private String dateOfBirth;
    private String phone;
    private String address;

    public boolean hasName() {
        return (firstName != null && !firstName.isBlank()) || (lastName != null && !lastName.isBlank());
    }
}
