package com.itq.formledger.security;

import com.itq.formledger.domain.Address;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical bytes a caller signs to authorize one instruction. Each field is
 * UTF-8 encoded and prefixed with its length as a 4-byte big-endian int, so no
 * two different argument lists encode to the same bytes. The program id binds
 * the signature to one deployment and the caller's nonce binds it to one use.
 */
public final class InstructionMessage {

    public static final String DOMAIN = "formledger";

    public static final String INITIALIZE = "initialize_admin_config";
    public static final String ADD_ADMIN = "add_admin";
    public static final String REMOVE_ADMIN = "remove_admin";
    public static final String SIGN_FORM_SUBMISSION = "sign_form_submission";
    public static final String UPDATE_FORM_APPROVAL = "update_form_approval";

    private final List<String> fields = new ArrayList<>();
    private final long nonce;

    private InstructionMessage(Address programId, String instruction, long nonce) {
        this.nonce = nonce;
        fields.add(DOMAIN);
        fields.add(programId.toHex());
        fields.add(instruction);
        fields.add(Long.toString(nonce));
    }

    public static InstructionMessage of(Address programId, String instruction, long nonce) {
        return new InstructionMessage(programId, instruction, nonce);
    }

    public long getNonce() {
        return nonce;
    }

    /** Appends an argument; {@code null} (an absent optional) encodes as an empty field. */
    public InstructionMessage arg(String value) {
        fields.add(value == null ? "" : value);
        return this;
    }

    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (String field : fields) {
            byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
            out.writeBytes(ByteBuffer.allocate(4).putInt(bytes.length).array());
            out.writeBytes(bytes);
        }
        return out.toByteArray();
    }
}
