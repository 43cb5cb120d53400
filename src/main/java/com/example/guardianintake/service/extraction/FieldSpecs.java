package com.example.guardianintake.service.extraction;

import com.example.guardianintake.dto.extraction.FieldShape;
import com.example.guardianintake.dto.extraction.FieldSpec;
import com.example.guardianintake.dto.rules.CorrectionScope;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Field labels as they appear on the intake form. A label may carry a "(s)" suffix and
 * is followed by whitespace, a colon or a dash.
 */
public final class FieldSpecs {

    public static final FieldSpec NAME = spec("name", "names?", FieldShape.NAME, CorrectionScope.NAME, 1);

    public static final FieldSpec DATE_OF_BIRTH = spec("dateOfBirth",
        "dob|d\\.o\\.b\\.?|date\\s+of\\s+birth|birth\\s*date", FieldShape.DATE, CorrectionScope.DATE, 1);

    public static final FieldSpec PHONE = spec("phone",
        "(?:home\\s+|cell\\s+|mobile\\s+)?(?:phone|tele(?:phone)?)(?:\\s*(?:no\\.?|number|#))?|cell",
        FieldShape.PHONE, CorrectionScope.PHONE, 1);

    public static final FieldSpec EMAIL = spec("email", "e-?mail(?:\\s+address)?", FieldShape.EMAIL,
        CorrectionScope.EMAIL, 1);

    public static final FieldSpec ADDRESS = spec("address",
        "(?:mailing\\s+|street\\s+|home\\s+)?address(?:es)?(?:\\s*\\(\\s*no\\s*p\\.?\\s*o\\.?\\s*box(?:es)?\\s*\\))?",
        FieldShape.ADDRESS, CorrectionScope.ADDRESS, 2);

    public static final FieldSpec CITY_STATE_ZIP = spec("cityStateZip",
        "city\\s*/?\\s*,?\\s*state\\s*/?\\s*,?\\s*zip(?:\\s*code)?", FieldShape.ADDRESS, CorrectionScope.ADDRESS, 1);

    public static final FieldSpec RELATIONSHIP = spec("relationship",
        "relationship(?:\\s+to\\s+(?:the\\s+)?ward)?", FieldShape.RELATIONSHIP, CorrectionScope.RELATIONSHIP, 1);

    /** Only used to end the previous field's value. */
    public static final FieldSpec AGE = spec("age", "age", FieldShape.TEXT, CorrectionScope.GLOBAL, 1);

    public static final List<FieldSpec> ALL = List.of(NAME, DATE_OF_BIRTH, PHONE, EMAIL, ADDRESS, CITY_STATE_ZIP,
        RELATIONSHIP, AGE);

    private FieldSpecs() {
    }

    private static FieldSpec spec(String name, String core, FieldShape shape, CorrectionScope scope, int maxLines) {
        Pattern label = Pattern.compile("(?i)(?<![\\w@.])(?:" + core + ")(?:\\s*\\(\\s*s\\s*\\))?(?:\\s*[:\\-#]|(?=\\s)|$)");
        return new FieldSpec(name, label, shape, scope, maxLines);
    }
}
