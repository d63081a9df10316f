package org.salesintel.service.schema;

import org.salesintel.models.dto.CanonicalFieldDefinition;
import org.salesintel.models.dto.CanonicalFieldSchema;
import org.salesintel.models.dto.MappingKey;
import org.salesintel.models.dto.SourceFieldDefinition;
import org.salesintel.models.dto.SourceFieldSchema;
import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.FieldDataType;
import org.salesintel.models.enums.SourceSystem;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.salesintel.models.enums.FieldDataType.BOOLEAN;
import static org.salesintel.models.enums.FieldDataType.DATE;
import static org.salesintel.models.enums.FieldDataType.DATETIME;
import static org.salesintel.models.enums.FieldDataType.FLOAT;
import static org.salesintel.models.enums.FieldDataType.INTEGER;
import static org.salesintel.models.enums.FieldDataType.LIST;
import static org.salesintel.models.enums.FieldDataType.MONETARY;
import static org.salesintel.models.enums.FieldDataType.OBJECT;
import static org.salesintel.models.enums.FieldDataType.REFERENCE;
import static org.salesintel.models.enums.FieldDataType.SELECTION;
import static org.salesintel.models.enums.FieldDataType.TEXT;

/**
 * Built-in schemas served when a live provider cannot answer. Source schemas are keyed by
 * (system, entity); canonical schemas by entity.
 */
@Component
public class DefaultSchemaCatalog {

    private final Map<MappingKey, List<SourceFieldDefinition>> sourceFields = new HashMap<>();
    private final Map<EntityType, List<CanonicalFieldDefinition>> canonicalFields = new EnumMap<>(EntityType.class);

    public DefaultSchemaCatalog() {
        registerOdooSources();
        registerMs365Sources();
        registerSalesforceSources();
        registerCanonicalSchemas();
    }

    public SourceFieldSchema sourceSchema(SourceSystem system, EntityType entity) {
        return new SourceFieldSchema(system, entity, sourceFields.getOrDefault(new MappingKey(system, entity), List.of()));
    }

    public CanonicalFieldSchema canonicalSchema(EntityType entity) {
        return new CanonicalFieldSchema(entity, canonicalFields.getOrDefault(entity, List.of()));
    }

    private void registerOdooSources() {
        source(SourceSystem.ODOO, EntityType.ACCOUNT,
                field("id", "ID", INTEGER),
                field("name", "Company Name", TEXT),
                field("email", "Email", TEXT),
                field("phone", "Phone", TEXT),
                field("website", "Website", TEXT),
                field("street", "Street Address", TEXT),
                field("street2", "Street Address 2", TEXT),
                field("city", "City", TEXT),
                field("zip", "ZIP Code", TEXT),
                field("state_id", "State", REFERENCE),
                field("country_id", "Country", REFERENCE),
                field("industry_id", "Industry", REFERENCE),
                field("user_id", "Salesperson", REFERENCE),
                field("create_date", "Created On", DATETIME),
                field("write_date", "Last Updated", DATETIME));

        source(SourceSystem.ODOO, EntityType.OPPORTUNITY,
                field("id", "ID", INTEGER),
                field("name", "Opportunity Name", TEXT),
                field("partner_id", "Customer", REFERENCE),
                field("expected_revenue", "Expected Revenue", MONETARY),
                field("probability", "Probability (%)", FLOAT),
                field("stage_id", "Stage", REFERENCE),
                field("user_id", "Salesperson", REFERENCE),
                field("date_deadline", "Expected Closing", DATE),
                field("description", "Internal Notes", TEXT),
                field("create_date", "Created On", DATETIME),
                field("write_date", "Last Updated", DATETIME));

        source(SourceSystem.ODOO, EntityType.CONTACT,
                field("id", "ID", INTEGER),
                field("name", "Contact Name", TEXT),
                field("email", "Email", TEXT),
                field("phone", "Phone", TEXT),
                field("parent_id", "Company", REFERENCE),
                field("function", "Job Position", TEXT),
                field("create_date", "Created On", DATETIME),
                field("write_date", "Last Updated", DATETIME));

        source(SourceSystem.ODOO, EntityType.ORDER,
                field("id", "ID", INTEGER),
                field("name", "Order Reference", TEXT),
                field("partner_id", "Customer", REFERENCE),
                field("amount_total", "Total Amount", MONETARY),
                field("amount_untaxed", "Untaxed Amount", MONETARY),
                field("amount_tax", "Tax Amount", MONETARY),
                field("state", "Status", SELECTION),
                field("date_order", "Order Date", DATETIME),
                field("user_id", "Salesperson", REFERENCE),
                field("create_date", "Created On", DATETIME),
                field("write_date", "Last Updated", DATETIME));

        source(SourceSystem.ODOO, EntityType.INVOICE,
                field("id", "ID", INTEGER),
                field("name", "Invoice Number", TEXT),
                field("partner_id", "Customer", REFERENCE),
                field("amount_total", "Total Amount", MONETARY),
                field("amount_residual", "Amount Due", MONETARY),
                field("state", "Status", SELECTION),
                field("payment_state", "Payment Status", SELECTION),
                field("invoice_date", "Invoice Date", DATE),
                field("invoice_date_due", "Due Date", DATE),
                field("user_id", "Salesperson", REFERENCE),
                field("create_date", "Created On", DATETIME),
                field("write_date", "Last Updated", DATETIME));
    }

    private void registerMs365Sources() {
        source(SourceSystem.MS365, EntityType.USER,
                field("id", "User ID", TEXT),
                field("displayName", "Display Name", TEXT),
                field("mail", "Email", TEXT),
                field("userPrincipalName", "User Principal Name", TEXT),
                field("jobTitle", "Job Title", TEXT),
                field("department", "Department", TEXT),
                field("mobilePhone", "Mobile Phone", TEXT),
                field("officeLocation", "Office Location", TEXT));

        source(SourceSystem.MS365, EntityType.EMAIL,
                field("id", "Message ID", TEXT),
                field("subject", "Subject", TEXT),
                field("from", "From", OBJECT),
                field("toRecipients", "To Recipients", LIST),
                field("receivedDateTime", "Received Date", DATETIME),
                field("bodyPreview", "Body Preview", TEXT),
                field("hasAttachments", "Has Attachments", BOOLEAN),
                field("importance", "Importance", TEXT));

        source(SourceSystem.MS365, EntityType.CALENDAR,
                field("id", "Event ID", TEXT),
                field("subject", "Subject", TEXT),
                field("start", "Start Time", OBJECT),
                field("end", "End Time", OBJECT),
                field("organizer", "Organizer", OBJECT),
                field("attendees", "Attendees", LIST),
                field("location", "Location", TEXT),
                field("isAllDay", "All Day Event", BOOLEAN));
    }

    private void registerSalesforceSources() {
        source(SourceSystem.SALESFORCE, EntityType.LEAD,
                field("Id", "Lead ID", TEXT),
                field("Name", "Full Name", TEXT),
                field("FirstName", "First Name", TEXT),
                field("LastName", "Last Name", TEXT),
                field("Email", "Email", TEXT),
                field("Phone", "Phone", TEXT),
                field("Company", "Company", TEXT),
                field("Status", "Lead Status", SELECTION),
                field("LeadSource", "Lead Source", SELECTION),
                field("Owner", "Lead Owner", REFERENCE),
                field("CreatedDate", "Created Date", DATETIME),
                field("LastModifiedDate", "Last Modified Date", DATETIME));

        source(SourceSystem.SALESFORCE, EntityType.ACCOUNT,
                field("Id", "Account ID", TEXT),
                field("Name", "Account Name", TEXT),
                field("Phone", "Phone", TEXT),
                field("Website", "Website", TEXT),
                field("Industry", "Industry", SELECTION),
                field("AnnualRevenue", "Annual Revenue", MONETARY),
                field("NumberOfEmployees", "Employees", INTEGER),
                field("BillingStreet", "Billing Street", TEXT),
                field("BillingCity", "Billing City", TEXT),
                field("BillingPostalCode", "Billing Zip/Postal Code", TEXT),
                field("BillingState", "Billing State/Province", TEXT),
                field("BillingCountry", "Billing Country", TEXT),
                field("Owner", "Account Owner", REFERENCE),
                field("CreatedDate", "Created Date", DATETIME),
                field("LastModifiedDate", "Last Modified Date", DATETIME));

        source(SourceSystem.SALESFORCE, EntityType.OPPORTUNITY,
                field("Id", "Opportunity ID", TEXT),
                field("Name", "Opportunity Name", TEXT),
                field("Account", "Account", REFERENCE),
                field("Amount", "Amount", MONETARY),
                field("Probability", "Probability (%)", FLOAT),
                field("StageName", "Stage", SELECTION),
                field("CloseDate", "Close Date", DATE),
                field("Description", "Description", TEXT),
                field("Owner", "Opportunity Owner", REFERENCE),
                field("CreatedDate", "Created Date", DATETIME),
                field("LastModifiedDate", "Last Modified Date", DATETIME));
    }

    private void registerCanonicalSchemas() {
        canonical(EntityType.ACCOUNT,
                target("name", TEXT, true, "Company Name"),
                target("email", TEXT, false, "Email Address"),
                target("phone", TEXT, false, "Phone Number"),
                target("website", TEXT, false, "Website URL"),
                target("industry", TEXT, false, "Industry sector"),
                target("annual_revenue", FLOAT, false, "Annual revenue"),
                target("employee_count", INTEGER, false, "Number of employees"),
                target("street", TEXT, false, "Street Address"),
                target("city", TEXT, false, "City"),
                target("zip", TEXT, false, "ZIP/Postal Code"),
                target("state_name", TEXT, false, "State/Region"),
                target("country_name", TEXT, false, "Country"),
                target("salesperson_name", TEXT, false, "Salesperson"),
                target("create_date", DATETIME, false, "Created On"),
                target("write_date", DATETIME, false, "Last Updated"));

        canonical(EntityType.OPPORTUNITY,
                target("name", TEXT, true, "Opportunity Name"),
                target("partner_name", TEXT, false, "Customer Name"),
                target("partner_id", INTEGER, false, "Customer ID"),
                target("expected_revenue", FLOAT, false, "Expected Revenue"),
                target("probability", FLOAT, false, "Probability (%)"),
                target("stage_name", TEXT, false, "Stage Name"),
                target("date_deadline", DATE, false, "Expected Closing"),
                target("description", TEXT, false, "Internal Notes"),
                target("salesperson_name", TEXT, false, "Salesperson"),
                target("salesperson_id", INTEGER, false, "Salesperson ID"),
                target("create_date", DATETIME, false, "Created On"),
                target("write_date", DATETIME, false, "Last Updated"));

        canonical(EntityType.CONTACT,
                target("name", TEXT, true, "Contact Name"),
                target("email", TEXT, false, "Email Address"),
                target("phone", TEXT, false, "Phone Number"),
                target("company_name", TEXT, false, "Company Name"),
                target("company_id", INTEGER, false, "Company ID"),
                target("function", TEXT, false, "Job Position"),
                target("create_date", DATETIME, false, "Created On"),
                target("write_date", DATETIME, false, "Last Updated"));

        canonical(EntityType.ORDER,
                target("name", TEXT, true, "Order Reference"),
                target("partner_name", TEXT, false, "Customer Name"),
                target("partner_id", INTEGER, false, "Customer ID"),
                target("amount_total", FLOAT, false, "Total Amount"),
                target("amount_untaxed", FLOAT, false, "Untaxed Amount"),
                target("amount_tax", FLOAT, false, "Tax Amount"),
                target("state", TEXT, false, "Status"),
                target("date_order", DATETIME, false, "Order Date"),
                target("salesperson_name", TEXT, false, "Salesperson"),
                target("create_date", DATETIME, false, "Created On"),
                target("write_date", DATETIME, false, "Last Updated"));

        canonical(EntityType.INVOICE,
                target("name", TEXT, true, "Invoice Number"),
                target("partner_name", TEXT, false, "Customer Name"),
                target("partner_id", INTEGER, false, "Customer ID"),
                target("amount_total", FLOAT, false, "Total Amount"),
                target("amount_residual", FLOAT, false, "Amount Due"),
                target("state", TEXT, false, "Status"),
                target("payment_state", TEXT, false, "Payment Status"),
                target("invoice_date", DATE, false, "Invoice Date"),
                target("invoice_date_due", DATE, false, "Due Date"),
                target("salesperson_name", TEXT, false, "Salesperson"),
                target("create_date", DATETIME, false, "Created On"),
                target("write_date", DATETIME, false, "Last Updated"));

        canonical(EntityType.LEAD,
                target("name", TEXT, true, "Lead Name"),
                target("first_name", TEXT, false, "First Name"),
                target("last_name", TEXT, false, "Last Name"),
                target("email", TEXT, false, "Email Address"),
                target("phone", TEXT, false, "Phone Number"),
                target("company_name", TEXT, false, "Company Name"),
                target("status", TEXT, false, "Lead Status"),
                target("lead_source", TEXT, false, "Lead Source"),
                target("salesperson_name", TEXT, false, "Lead Owner"),
                target("create_date", DATETIME, false, "Created On"),
                target("write_date", DATETIME, false, "Last Updated"));

        canonical(EntityType.USER,
                target("full_name", TEXT, true, "Full Name"),
                target("email", TEXT, true, "Email Address"),
                target("job_title", TEXT, false, "Job Title"),
                target("department", TEXT, false, "Department"),
                target("phone", TEXT, false, "Phone Number"),
                target("office_location", TEXT, false, "Office Location"));

        canonical(EntityType.EMAIL,
                target("subject", TEXT, true, "Email Subject"),
                target("from_email", TEXT, false, "Sender Email"),
                target("from_name", TEXT, false, "Sender Name"),
                target("received_at", DATETIME, false, "Received Date"),
                target("body_preview", TEXT, false, "Body Preview"),
                target("has_attachments", BOOLEAN, false, "Has Attachments"));

        canonical(EntityType.CALENDAR,
                target("subject", TEXT, true, "Event Title"),
                target("start_time", DATETIME, true, "Start Time"),
                target("end_time", DATETIME, false, "End Time"),
                target("organizer_email", TEXT, false, "Organizer Email"),
                target("location", TEXT, false, "Location"),
                target("is_all_day", BOOLEAN, false, "All Day Event"));
    }

    private void source(SourceSystem system, EntityType entity, SourceFieldDefinition... fields) {
        sourceFields.put(new MappingKey(system, entity), List.of(fields));
    }

    private void canonical(EntityType entity, CanonicalFieldDefinition... fields) {
        canonicalFields.put(entity, List.of(fields));
    }

    private static SourceFieldDefinition field(String name, String label, FieldDataType type) {
        return new SourceFieldDefinition(name, label, type);
    }

    private static CanonicalFieldDefinition target(String name, FieldDataType type,
                                                   boolean required, String description) {
        return new CanonicalFieldDefinition(name, type, required, description);
    }
}
