package com.demoPayroll.taxEngine.normalizer.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default shape of every declaration section. The defaults double as the schema of
 * the form record: every key listed here is always present after normalization.
 * 
 * String defaults stay strings, numeric defaults are numbers and boolean defaults
 * are booleans; the normalizer coerces source values to the default's type.
 */
public final class DefaultTaxationState {
    
    public static final String DEFAULT_REGIME = "old";
    public static final String DEFAULT_CITY_TYPE = "non_metro";
    
    private DefaultTaxationState() {}
    
    /**
     * Builds the default shape for one section. Each call returns new maps.
     */
    public static Map<String, Object> section(DeclarationSection section) {
        return switch (section) {
            case SALARY_INCOME -> salaryIncome();
            case OTHER_INCOME -> otherIncome();
            case HOUSE_PROPERTY_INCOME -> housePropertyIncome();
            case CAPITAL_GAINS_INCOME -> capitalGainsIncome();
            case RETIREMENT_BENEFITS -> retirementBenefits();
            case DEDUCTIONS -> deductions();
            case PERQUISITES -> perquisites();
        };
    }
    
    private static Map<String, Object> salaryIncome() {
        Map<String, Object> salary = zeros(
                "basic_salary", "dearness_allowance", "hra_received", "actual_rent_paid");
        salary.put("hra_city_type", DEFAULT_CITY_TYPE);
        salary.putAll(zeros(
                "special_allowance", "conveyance_allowance", "medical_allowance", "other_allowances",
                "bonus", "commission", "lta_received",
                "city_compensatory_allowance", "rural_allowance", "proctorship_allowance",
                "wardenship_allowance", "project_allowance", "deputation_allowance", "overtime_allowance",
                "interim_relief", "tiffin_allowance", "servant_allowance",
                "govt_employees_outside_india_allowance", "supreme_high_court_judges_allowance",
                "judge_compensatory_allowance", "section_10_14_special_allowances",
                "any_other_allowance_exemption", "travel_on_tour_allowance", "tour_daily_charge_allowance",
                "conveyance_in_performace_of_duties", "helper_in_performace_of_duties",
                "academic_research", "uniform_allowance",
                "hills_high_altd_allowance", "hills_high_altd_exemption_limit",
                "border_remote_allowance", "border_remote_exemption_limit",
                "transport_employee_allowance",
                "children_education_allowance", "children_education_count", "children_education_months",
                "hostel_allowance", "hostel_count", "hostel_months",
                "transport_months", "underground_mines_allowance", "underground_mines_months",
                "govt_employee_entertainment_allowance"));
        return salary;
    }
    
    private static Map<String, Object> otherIncome() {
        Map<String, Object> other = new LinkedHashMap<>();
        other.put("interest_income", zeros(
                "savings_account_interest", "fixed_deposit_interest",
                "recurring_deposit_interest", "post_office_interest"));
        other.putAll(zeros(
                "dividend_income", "gifts_received", "business_professional_income",
                "other_miscellaneous_income"));
        return other;
    }
    
    private static Map<String, Object> housePropertyIncome() {
        Map<String, Object> house = new LinkedHashMap<>();
        house.put("property_type", "Self-Occupied");
        house.put("occupancy_status", "Self-Occupied");
        house.put("property_address", "");
        house.putAll(zeros(
                "annual_rent_received", "municipal_taxes_paid", "home_loan_interest",
                "pre_construction_interest", "fair_rental_value", "standard_rent"));
        return house;
    }
    
    private static Map<String, Object> capitalGainsIncome() {
        return zeros(
                "stcg_111a_equity_stt", "stcg_other_assets", "stcg_debt_mf",
                "ltcg_112a_equity_stt", "ltcg_other_assets", "ltcg_debt_mf");
    }
    
    private static Map<String, Object> retirementBenefits() {
        Map<String, Object> benefits = new LinkedHashMap<>();
        
        Map<String, Object> leaveEncashment = zeros(
                "leave_encashment_income_received", "leave_encashment_exemption", "leave_encashment_taxable");
        leaveEncashment.put("is_deceased", false);
        leaveEncashment.put("during_employment", false);
        benefits.put("leave_encashment", leaveEncashment);
        
        Map<String, Object> pension = zeros(
                "pension_received", "commuted_pension", "uncommuted_pension", "computed_pension_percentage");
        pension.put("uncomputed_pension_frequency", "Monthly");
        pension.put("uncomputed_pension_amount", 0.0);
        benefits.put("pension", pension);
        
        Map<String, Object> vrs = zeros("compensation_received", "exemption_limit", "taxable_amount");
        vrs.put("is_vrs_requested", false);
        benefits.put("vrs", vrs);
        
        benefits.put("gratuity", zeros("gratuity_received", "exemption_limit", "taxable_amount"));
        
        Map<String, Object> retrenchment = zeros("compensation_received", "exemption_limit", "taxable_amount");
        retrenchment.put("is_provided", false);
        benefits.put("retrenchment_compensation", retrenchment);
        return benefits;
    }
    
    private static Map<String, Object> deductions() {
        Map<String, Object> deductions = new LinkedHashMap<>();
        deductions.put("section_80c", zeros(
                "life_insurance_premium", "epf_contribution", "ssp_contribution", "nsc_investment",
                "ulip_investment", "tax_saver_mutual_fund", "tuition_fees_for_two_children",
                "principal_amount_paid_home_loan", "sukanya_deposit_plan_for_girl_child",
                "tax_saver_fixed_deposit_5_years_bank", "senior_citizen_savings_scheme", "others"));
        deductions.put("section_80ccc", zeros("pension_plan_insurance_company"));
        deductions.put("section_80ccd", zeros(
                "nps_contribution_10_percent", "additional_nps_50k", "employer_nps_contribution"));
        deductions.put("section_80d", zeros(
                "self_family_premium", "preventive_health_checkup_self", "parent_premium", "parent_age"));
        
        Map<String, Object> section80dd = zeros("amount");
        section80dd.put("relation", "");
        section80dd.put("disability_percentage", "");
        deductions.put("section_80dd", section80dd);
        
        Map<String, Object> section80ddb = zeros("amount");
        section80ddb.put("relation", "");
        deductions.put("section_80ddb", section80ddb);
        
        deductions.put("section_80e", zeros("education_loan_interest"));
        deductions.put("section_80eeb", zeros("amount"));
        deductions.put("section_80g", zeros(
                "donation_100_percent_without_limit", "donation_50_percent_without_limit",
                "donation_100_percent_with_limit", "donation_50_percent_with_limit"));
        deductions.put("section_80ggc", zeros("amount"));
        
        Map<String, Object> section80u = zeros("amount");
        section80u.put("disability_percentage", "");
        deductions.put("section_80u", section80u);
        return deductions;
    }
    
    private static Map<String, Object> perquisites() {
        Map<String, Object> perquisites = new LinkedHashMap<>();
        
        Map<String, Object> accommodation = new LinkedHashMap<>();
        accommodation.put("accommodation_type", "none");
        accommodation.putAll(zeros("accommodation_value", "accommodation_govt_lic_fees"));
        accommodation.put("accommodation_city_population", "");
        accommodation.put("accommodation_rent", 0.0);
        accommodation.put("is_furniture_owned", false);
        accommodation.put("furniture_actual_cost", 0.0);
        perquisites.put("accommodation", accommodation);
        
        Map<String, Object> car = new LinkedHashMap<>();
        car.put("car_provided", false);
        car.put("car_cc", 0.0);
        car.put("car_owned_by", "company");
        car.putAll(zeros("car_used_for_business", "car_value", "driver_salary"));
        car.put("fuel_provided", false);
        car.put("fuel_value", 0.0);
        perquisites.put("car_transport", car);
        
        perquisites.put("gas_electricity_water", zeros("amount"));
        perquisites.put("medical_reimbursement", zeros("amount"));
        perquisites.put("leave_travel_allowance", zeros("lta_claimed", "lta_exempt"));
        
        Map<String, Object> education = new LinkedHashMap<>();
        education.put("education_provided", false);
        education.put("education_value", 0.0);
        perquisites.put("free_education", education);
        
        perquisites.put("loans", zeros("loan_amount", "loan_interest_rate", "loan_interest_benefit"));
        
        Map<String, Object> movable = new LinkedHashMap<>();
        movable.put("movable_assets_value", 0.0);
        movable.put("mau_ownership", "");
        movable.putAll(zeros("mau_value_to_employer", "mau_value_to_employee"));
        movable.put("mat_type", "");
        movable.putAll(zeros("mat_value_to_employer", "mat_value_to_employee",
                "mat_number_of_completed_years_of_use"));
        perquisites.put("movable_assets", movable);
        
        perquisites.put("esop_stock_options", zeros("esop_value", "esop_exercise_price", "esop_market_price"));
        perquisites.put("other_perquisites", zeros(
                "domestic_help_amount_paid_by_employer", "domestic_help_amount_paid_by_employee",
                "gardener_amount_paid_by_employer", "sweeper_amount_paid_by_employer",
                "personal_attendant_amount_paid_by_employer", "security_amount_paid_by_employer",
                "watchman_amount_paid_by_employer", "credit_card_amount_paid_by_employer",
                "club_expenses_amount_paid_by_employer", "club_expenses_amount_paid_by_employee",
                "use_of_movable_assets_amount_paid_by_employer",
                "transfer_of_movable_assets_amount_paid_by_employer",
                "interest_free_loan_amount_paid_by_employer", "club_expenses_amount_paid_for_offical_purpose",
                "lunch_amount_paid_by_employer", "lunch_amount_paid_by_employee",
                "monetary_amount_paid_by_employer", "expenditure_for_offical_purpose",
                "monetary_benefits_amount_paid_by_employee", "gift_vouchers_amount_paid_by_employer",
                "total_perquisites"));
        return perquisites;
    }
    
    private static Map<String, Object> zeros(String... fields) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String field : fields) {
            map.put(field, 0.0);
        }
        return map;
    }
}
