package org.ledgerswap.data.escrow;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity details submitted when registering with the escrow service.
 * <p>
 * Field names match the service's form parameters.
 */
public class KycData {

	public String name;
	public String birthdayYear;
	public String birthdayMonth;
	public String birthdayDay;
	public String taxCountry;
	public String taxIdNumber;
	public String addressStreet1;
	public String addressCity;
	public String addressPostalCode;
	public String addressRegion;
	public String addressCountry;
	public String primaryPhoneNumber;
	public String gender;

	public KycData() {
	}

	public Map<String, String> toFormParameters() {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("name", this.name);
		params.put("birthday[year]", this.birthdayYear);
		params.put("birthday[month]", this.birthdayMonth);
		params.put("birthday[day]", this.birthdayDay);
		params.put("tax-country", this.taxCountry);
		params.put("tax-id-number", this.taxIdNumber);
		params.put("address[street-1]", this.addressStreet1);
		params.put("address[city]", this.addressCity);
		params.put("address[postal-code]", this.addressPostalCode);
		params.put("address[region]", this.addressRegion);
		params.put("address[country]", this.addressCountry);
		params.put("primary-phone-number", this.primaryPhoneNumber);
		params.put("gender", this.gender);
		return params;
	}

}
