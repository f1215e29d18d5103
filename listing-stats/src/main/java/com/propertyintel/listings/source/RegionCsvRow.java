package com.propertyintel.listings.source;

import com.opencsv.bean.CsvBindByName;
import com.propertyintel.listings.model.RegionReference;
import lombok.Data;

/**
 * One row of the UZEMI administrative table export.
 */
@Data
public class RegionCsvRow {

    @CsvBindByName(column = "okres_text")
    private String district;

    @CsvBindByName(column = "kraj_text")
    private String region;

    public RegionReference toReference() {
        return new RegionReference(district, region);
    }
}
