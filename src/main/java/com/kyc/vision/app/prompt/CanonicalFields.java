package com.kyc.vision.app.prompt;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Superset of identity and supporting-document keys the model is told to use for {@code fields}.
 * Anything else it reads goes to {@code extra_fields}.
 */
public final class CanonicalFields {

  private CanonicalFields() {}

  static final List<String> PERSON =
      List.of(
          "surname", "given_names", "first_name", "middle_names", "full_name", "alias_name");

  static final List<String> IDENTIFIERS =
      List.of(
          "document_number",
          "passport_number",
          "national_id_number",
          "nin",
          "voter_id_number",
          "driver_license_number",
          "license_number",
          "permit_number",
          "work_permit_number",
          "residence_permit_number",
          "tax_id_number",
          "social_security_number",
          "account_number",
          "customer_number",
          "reference_number",
          "file_number",
          "card_number",
          "folio_number",
          "deed_number",
          "parcel_number",
          "plot_number",
          "survey_plan_number",
          "title_number",
          "certificate_number");

  static final List<String> MRZ = List.of("mrz_line1", "mrz_line2", "mrz_line3");

  static final List<String> DATES =
      List.of(
          "date_of_birth",
          "place_of_birth",
          "date_of_issue",
          "date_of_expiry",
          "date_of_registration",
          "date_of_execution",
          "date_of_signature",
          "date_of_transfer",
          "issue_date",
          "expiry_date",
          "effective_date",
          "statement_period_start",
          "statement_period_end",
          "billing_period_start",
          "billing_period_end");

  static final List<String> CLASSIFICATION =
      List.of(
          "document_type_label",
          "document_category",
          "class_code",
          "vehicle_class",
          "license_class",
          "restriction_codes",
          "endorsement_codes");

  static final List<String> NATIONALITY =
      List.of(
          "nationality",
          "nationality_code",
          "issuing_country",
          "issuing_authority",
          "country_of_issue");

  static final List<String> PERSONAL_ATTRIBUTES =
      List.of(
          "sex",
          "gender",
          "marital_status",
          "profession",
          "occupation",
          "tribe",
          "religion",
          "height",
          "weight",
          "eye_color",
          "hair_color",
          "distinguishing_marks",
          "signature_present");

  static final List<String> CONTACT =
      List.of(
          "address_line1",
          "address_line2",
          "address_line3",
          "city",
          "state",
          "province",
          "region",
          "postal_code",
          "country",
          "residence_status",
          "phone_number",
          "email");

  static final List<String> VOTER =
      List.of("polling_unit", "ward", "lga", "constituency", "state_code", "vin");

  static final List<String> DRIVER_LICENSE =
      List.of(
          "issuing_office",
          "driver_restrictions",
          "driver_endorsements",
          "driver_conditions",
          "vehicle_categories");

  static final List<String> FINANCIAL =
      List.of("bank_name", "branch_name", "iban", "swift_code", "balance", "currency");

  static final List<String> UTILITY =
      List.of("meter_number", "account_name", "service_address", "tariff", "billing_reference");

  static final List<String> PROPERTY =
      List.of(
          "property_address",
          "property_description",
          "land_size",
          "coordinates",
          "grantor_name",
          "grantee_name",
          "consideration_amount",
          "tenure_type",
          "encumbrances");

  static final List<String> VISA =
      List.of("visa_number", "visa_type", "visa_category", "visa_entries", "visa_issue_place");

  static final List<String> MISC =
      List.of(
          "barcode_value",
          "qr_code_value",
          "hash_value",
          "notes",
          "observations",
          "warnings",
          "seal_present",
          "hologram_present",
          "watermark_present");

  /** All canonical keys in prompt order. */
  public static final List<String> KEYS =
      Stream.of(
              PERSON,
              IDENTIFIERS,
              MRZ,
              DATES,
              CLASSIFICATION,
              NATIONALITY,
              PERSONAL_ATTRIBUTES,
              CONTACT,
              VOTER,
              DRIVER_LICENSE,
              FINANCIAL,
              UTILITY,
              PROPERTY,
              VISA,
              MISC)
          .flatMap(List::stream)
          .collect(Collectors.toUnmodifiableList());

  public static boolean isCanonical(String key) {
    return KEYS.contains(key);
  }
}
