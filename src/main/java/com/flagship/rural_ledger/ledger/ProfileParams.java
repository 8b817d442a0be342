package com.flagship.rural_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Declaration parameters of one producer profile. One row per profile name.
 */
@Value
@Builder(toBuilder = true)
public class ProfileParams {
    String profile;
    String version;
    Integer periodStartIndicator;
    Integer specialSituation;
    String ident;
    String name;
    String street;
    String number;
    String complement;
    String district;
    String state;
    String cityCode;
    String zipCode;
    String phone;
    String email;
}
