package com.ratbv.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.Frame;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import java.util.*;

/**
 * Tests for the Playwright session adapter against mocked Playwright objects.
 */
@ExtendWith(MockitoExtension.class)
public class PlaywrightBrowserSessionTest {
    @Mock
    private Playwright playwright;
    @Mock
    private Browser browser;
    @Mock
    private Page page;
    @Mock
    private Frame mainFrame;
    private PlaywrightBrowserSession session;

    @BeforeEach
    void setUp() {
        lenient().when(page.mainFrame()).thenReturn(mainFrame);
        lenient().when(mainFrame.url()).thenReturn("https://www.ratbv.ro/afisaje/23b-dus.html");
        session = new PlaywrightBrowserSession(playwright, browser, page, 50);
    }

    @Test
    void testSwitchToFrameSelectsChildByIndex() throws Exception {
        Frame header = mock(Frame.class);
        Frame list = mock(Frame.class);
        when(list.url()).thenReturn("https://www.ratbv.ro/afisaje/23b-dus/div_list_ro.html");
        when(mainFrame.childFrames()).thenReturn(List.of(header, list));

        session.navigate("https://www.ratbv.ro/afisaje/23b-dus.html");
        session.switchToFrame(1);
        assertEquals("https://www.ratbv.ro/afisaje/23b-dus/div_list_ro.html", session.currentUrl());

        session.switchToDefaultContent();
        assertEquals("https://www.ratbv.ro/afisaje/23b-dus.html", session.currentUrl());
    }

    @Test
    void testOutOfRangeFrameFails() {
        when(mainFrame.childFrames()).thenReturn(List.of(mock(Frame.class)));

        assertThrows(ScrapeFailureException.class, () -> session.switchToFrame(2));
    }

    @Test
    void testNavigationErrorTranslated() {
        when(page.navigate("https://bad")).thenThrow(new PlaywrightException("net::ERR_NAME_NOT_RESOLVED"));

        ScrapeFailureException e = assertThrows(ScrapeFailureException.class, () -> session.navigate("https://bad"));
        assertTrue(e.getMessage().contains("ERR_NAME_NOT_RESOLVED"));
    }

    @Test
    void testLookupTimeoutBecomesElementNotFound() {
        Locator matches = mock(Locator.class);
        Locator first = mock(Locator.class);
        when(mainFrame.locator("#tabel2")).thenReturn(matches);
        when(matches.first()).thenReturn(first);
        doThrow(new TimeoutError("Timeout 50ms exceeded")).when(first).waitFor(any());

        ElementNotFoundException e = assertThrows(ElementNotFoundException.class, () -> session.findElement("#tabel2"));
        assertEquals("#tabel2", e.getSelector());
    }

    @Test
    void testFoundElementReadsTextAndAttributes() throws Exception {
        Locator matches = mock(Locator.class);
        Locator first = mock(Locator.class);
        when(mainFrame.locator("a")).thenReturn(matches);
        when(matches.first()).thenReturn(first);
        when(first.innerText()).thenReturn("Gara");
        when(first.getAttribute("href")).thenReturn("line_23b_2_cl1_ro.html");

        PageElement element = session.findElement("a");

        assertEquals("Gara", element.getText());
        assertEquals(Optional.of("line_23b_2_cl1_ro.html"), element.getAttribute("href"));
        assertEquals(Optional.empty(), element.getAttribute("title"));
    }

    @Test
    void testFindElementsWrapsEveryMatch() throws Exception {
        Locator matches = mock(Locator.class);
        when(mainFrame.locator(".list_statie")).thenReturn(matches);
        when(matches.all()).thenReturn(List.of(mock(Locator.class), mock(Locator.class)));

        assertEquals(2, session.findElements(".list_statie").size());
    }

    @Test
    void testCloseContinuesWhenAStepFailsAndIsIdempotent() {
        doThrow(new PlaywrightException("browser already gone")).when(browser).close();

        session.close();
        session.close();

        verify(page, times(1)).close();
        verify(browser, times(1)).close();
        verify(playwright, times(1)).close();
    }
}
