package com.itq.formledger.addressing;

import com.itq.formledger.domain.Address;
import lombok.Value;

@Value
public class DerivedAddress {
    Address address;
    int bump;
}
