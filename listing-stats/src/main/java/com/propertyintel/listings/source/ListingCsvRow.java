package com.propertyintel.listings.source;

import com.opencsv.bean.CsvBindByName;
import com.propertyintel.listings.model.RawListing;
import lombok.Data;

/**
 * One row of the flattened dataset-items export (Keboola column names).
 */
@Data
public class ListingCsvRow {

    @CsvBindByName(column = "id")
    private String id;

    @CsvBindByName(column = "createdAt")
    private String createdAt;

    @CsvBindByName(column = "data_offerType")
    private String offerType;

    @CsvBindByName(column = "data_type")
    private String type;

    @CsvBindByName(column = "data_priceTotal")
    private String priceTotal;

    @CsvBindByName(column = "data_livingArea")
    private String livingArea;

    @CsvBindByName(column = "data_district")
    private String district;

    @CsvBindByName(column = "data_gpsCoord_lat")
    private String latitude;

    @CsvBindByName(column = "data_gpsCoord_lon")
    private String longitude;

    public RawListing toRawListing() {
        return RawListing.builder()
                .id(id)
                .createdAt(createdAt)
                .offerType(offerType)
                .propertyType(type)
                .priceTotal(priceTotal)
                .livingArea(livingArea)
                .district(district)
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }
}
