package com.lux032.musiclibrary.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 乐队评价信息
 */
@Data
public class BandAnalysis {

    public static final double MIN_RATE = 0;
    public static final double MAX_RATE = 10;

    private String review = "";
    private double rate;
    private List<AlbumAnalysis> albums = new ArrayList<>();
    private List<String> similarBands = new ArrayList<>();

    @Data
    public static class AlbumAnalysis {
        private String albumName;
        private String review = "";
        private double rate;

        public AlbumAnalysis() {
        }

        public AlbumAnalysis(String albumName, String review, double rate) {
            this.albumName = albumName;
            this.review = review;
            this.rate = rate;
        }
    }

    /**
     * 评分是否都在 0-10 之间
     */
    public boolean hasValidRates() {
        if (rate < MIN_RATE || rate > MAX_RATE) {
            return false;
        }
        if (albums != null) {
            for (AlbumAnalysis album : albums) {
                if (album.getRate() < MIN_RATE || album.getRate() > MAX_RATE) {
                    return false;
                }
            }
        }
        return true;
    }
}
