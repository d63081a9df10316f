package org.salesintel.service.schema;

import org.salesintel.models.dto.FieldMapping;
import org.salesintel.models.dto.MappingKey;
import org.salesintel.models.dto.MappingSet;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.Provenance;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.models.enums.TransformType;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.salesintel.models.enums.TransformType.BOOLEAN;
import static org.salesintel.models.enums.TransformType.DATE_PARSE;
import static org.salesintel.models.enums.TransformType.EXTRACT_ID;
import static org.salesintel.models.enums.TransformType.EXTRACT_NAME;
import static org.salesintel.models.enums.TransformType.NONE;
import static org.salesintel.models.enums.TransformType.TO_FLOAT;
import static org.salesintel.models.enums.TransformType.TO_INT;

/**
 * Preset mapping tables applied when suggestions are unavailable. Entries carry
 * {@link Provenance#DEFAULT} and the confidences the tables were curated with.
 */
@Component
public class DefaultMappingCatalog {

    private final Map<MappingKey, List<FieldMapping>> tables = new HashMap<>();

    public DefaultMappingCatalog() {
        registerOdooTables();
        registerMs365Tables();
        registerSalesforceTables();
    }

    public Optional<MappingSet> find(SourceSystem system, EntityType entity) {
        List<FieldMapping> entries = tables.get(new MappingKey(system, entity));
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new MappingSet(system, entity, entries));
    }

    private void registerOdooTables() {
        table(SourceSystem.ODOO, EntityType.OPPORTUNITY,
                map("name", "name", NONE, 1.0),
                map("partner_id", "partner_name", EXTRACT_NAME, 0.95),
                map("partner_id", "partner_id", EXTRACT_ID, 0.95),
                map("expected_revenue", "expected_revenue", TO_FLOAT, 1.0),
                map("probability", "probability", NONE, 1.0),
                map("stage_id", "stage_name", EXTRACT_NAME, 0.95),
                map("date_deadline", "date_deadline", NONE, 1.0),
                map("description", "description", NONE, 1.0),
                map("user_id", "salesperson_name", EXTRACT_NAME, 0.95),
                map("create_date", "create_date", NONE, 1.0),
                map("write_date", "write_date", NONE, 1.0));

        table(SourceSystem.ODOO, EntityType.ACCOUNT,
                map("name", "name", NONE, 1.0),
                map("email", "email", NONE, 1.0),
                map("phone", "phone", NONE, 1.0),
                map("website", "website", NONE, 1.0),
                map("street", "street", NONE, 1.0),
                map("city", "city", NONE, 1.0),
                map("zip", "zip", NONE, 1.0),
                map("state_id", "state_name", EXTRACT_NAME, 0.95),
                map("country_id", "country_name", EXTRACT_NAME, 0.95),
                map("user_id", "salesperson_name", EXTRACT_NAME, 0.95),
                map("create_date", "create_date", NONE, 1.0),
                map("write_date", "write_date", NONE, 1.0));

        table(SourceSystem.ODOO, EntityType.CONTACT,
                map("name", "name", NONE, 1.0),
                map("email", "email", NONE, 1.0),
                map("phone", "phone", NONE, 1.0),
                map("parent_id", "company_name", EXTRACT_NAME, 0.95),
                map("parent_id", "company_id", EXTRACT_ID, 0.95),
                map("function", "function", NONE, 1.0),
                map("create_date", "create_date", NONE, 1.0),
                map("write_date", "write_date", NONE, 1.0));

        table(SourceSystem.ODOO, EntityType.ORDER,
                map("name", "name", NONE, 1.0),
                map("partner_id", "partner_name", EXTRACT_NAME, 0.95),
                map("partner_id", "partner_id", EXTRACT_ID, 0.95),
                map("amount_total", "amount_total", TO_FLOAT, 1.0),
                map("amount_untaxed", "amount_untaxed", TO_FLOAT, 1.0),
                map("amount_tax", "amount_tax", TO_FLOAT, 1.0),
                map("state", "state", NONE, 1.0),
                map("date_order", "date_order", NONE, 1.0),
                map("user_id", "salesperson_name", EXTRACT_NAME, 0.95),
                map("create_date", "create_date", NONE, 1.0),
                map("write_date", "write_date", NONE, 1.0));

        table(SourceSystem.ODOO, EntityType.INVOICE,
                map("name", "name", NONE, 1.0),
                map("partner_id", "partner_name", EXTRACT_NAME, 0.95),
                map("partner_id", "partner_id", EXTRACT_ID, 0.95),
                map("amount_total", "amount_total", TO_FLOAT, 1.0),
                map("amount_residual", "amount_residual", TO_FLOAT, 1.0),
                map("state", "state", NONE, 1.0),
                map("payment_state", "payment_state", NONE, 1.0),
                map("invoice_date", "invoice_date", NONE, 1.0),
                map("invoice_date_due", "invoice_date_due", NONE, 1.0),
                map("user_id", "salesperson_name", EXTRACT_NAME, 0.95),
                map("create_date", "create_date", NONE, 1.0),
                map("write_date", "write_date", NONE, 1.0));
    }

    private void registerMs365Tables() {
        table(SourceSystem.MS365, EntityType.USER,
                map("displayName", "full_name", NONE, 0.95),
                map("mail", "email", NONE, 0.95),
                map("jobTitle", "job_title", NONE, 0.95),
                map("department", "department", NONE, 1.0),
                map("mobilePhone", "phone", NONE, 0.85),
                map("officeLocation", "office_location", NONE, 0.95));

        table(SourceSystem.MS365, EntityType.EMAIL,
                map("subject", "subject", NONE, 1.0),
                map("receivedDateTime", "received_at", DATE_PARSE, 0.95),
                map("bodyPreview", "body_preview", NONE, 0.95),
                map("hasAttachments", "has_attachments", BOOLEAN, 0.95));

        // start/end/organizer are nested objects that no transform can flatten
        table(SourceSystem.MS365, EntityType.CALENDAR,
                map("subject", "subject", NONE, 1.0),
                map("location", "location", NONE, 0.9),
                map("isAllDay", "is_all_day", BOOLEAN, 0.95));
    }

    private void registerSalesforceTables() {
        table(SourceSystem.SALESFORCE, EntityType.LEAD,
                map("Name", "name", NONE, 1.0),
                map("FirstName", "first_name", NONE, 0.95),
                map("LastName", "last_name", NONE, 0.95),
                map("Email", "email", NONE, 1.0),
                map("Phone", "phone", NONE, 1.0),
                map("Company", "company_name", NONE, 0.95),
                map("Status", "status", NONE, 0.95),
                map("LeadSource", "lead_source", NONE, 0.95),
                map("Owner", "salesperson_name", EXTRACT_NAME, 0.9),
                map("CreatedDate", "create_date", DATE_PARSE, 0.95),
                map("LastModifiedDate", "write_date", DATE_PARSE, 0.95));

        table(SourceSystem.SALESFORCE, EntityType.ACCOUNT,
                map("Name", "name", NONE, 1.0),
                map("Phone", "phone", NONE, 1.0),
                map("Website", "website", NONE, 1.0),
                map("Industry", "industry", NONE, 0.95),
                map("AnnualRevenue", "annual_revenue", TO_FLOAT, 0.95),
                map("NumberOfEmployees", "employee_count", TO_INT, 0.95),
                map("BillingStreet", "street", NONE, 0.9),
                map("BillingCity", "city", NONE, 0.9),
                map("BillingPostalCode", "zip", NONE, 0.9),
                map("BillingState", "state_name", NONE, 0.9),
                map("BillingCountry", "country_name", NONE, 0.9),
                map("Owner", "salesperson_name", EXTRACT_NAME, 0.9),
                map("CreatedDate", "create_date", DATE_PARSE, 0.95),
                map("LastModifiedDate", "write_date", DATE_PARSE, 0.95));

        table(SourceSystem.SALESFORCE, EntityType.OPPORTUNITY,
                map("Name", "name", NONE, 1.0),
                map("Account", "partner_name", EXTRACT_NAME, 0.95),
                map("Amount", "expected_revenue", TO_FLOAT, 0.95),
                map("Probability", "probability", NONE, 0.95),
                map("StageName", "stage_name", NONE, 0.9),
                map("CloseDate", "date_deadline", DATE_PARSE, 0.9),
                map("Description", "description", NONE, 1.0),
                map("Owner", "salesperson_name", EXTRACT_NAME, 0.9),
                map("CreatedDate", "create_date", DATE_PARSE, 0.95),
                map("LastModifiedDate", "write_date", DATE_PARSE, 0.95));
    }

    private void table(SourceSystem system, EntityType entity, FieldMapping... entries) {
        tables.put(new MappingKey(system, entity), List.of(entries));
    }

    private static FieldMapping map(String source, String target, TransformType transform, double confidence) {
        return FieldMapping.of(source, target, transform, confidence, Provenance.DEFAULT);
    }
}
